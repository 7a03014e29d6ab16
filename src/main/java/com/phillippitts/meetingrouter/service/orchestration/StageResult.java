package com.phillippitts.meetingrouter.service.orchestration;

import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of one pipeline stage.
 *
 * <p>{@link Status#ISOLATED_FAILURE} is a stage failure that is logged and reported as a zero
 * contribution. {@link Status#ABORTED} fails the whole request.
 *
 * @param status stage status
 * @param value  stage output, present only on success
 * @param reason why the stage was skipped or failed, {@code null} on success
 * @param error  failure cause, present only for failures
 * @param <T>    stage output type
 */
public record StageResult<T>(Status status, T value, String reason, Throwable error) {

    public enum Status {
        SUCCESS, SKIPPED, ISOLATED_FAILURE, ABORTED;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public StageResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(Status.SUCCESS, value, null, null);
    }

    public static <T> StageResult<T> skipped(String reason) {
        return new StageResult<>(Status.SKIPPED, null, reason, null);
    }

    public static <T> StageResult<T> isolatedFailure(String reason, Throwable error) {
        return new StageResult<>(Status.ISOLATED_FAILURE, null, reason, error);
    }

    public static <T> StageResult<T> aborted(String reason, Throwable error) {
        return new StageResult<>(Status.ABORTED, null, reason, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
