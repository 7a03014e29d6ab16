package com.phillippitts.meetingrouter.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void meetingRouterExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        MeetingRouterException ex = new MeetingRouterException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidPayloadExceptionShouldKeepReason() {
        InvalidPayloadException ex = new InvalidPayloadException("Empty payload");

        assertThat(ex).isInstanceOf(MeetingRouterException.class);
        assertThat(ex.getReason()).isEqualTo("Empty payload");
        assertThat(ex.getMessage()).contains("Empty payload");
    }

    @Test
    void missingCredentialExceptionShouldNameRoute() {
        MissingCredentialException ex = new MissingCredentialException("ClickUp API token", "OpenCables");

        assertThat(ex.getCredentialName()).isEqualTo("ClickUp API token");
        assertThat(ex.getMessage()).contains("OpenCables");
    }

    @Test
    void missingIdentifierExceptionShouldBeRemoteServiceException() {
        MissingIdentifierException ex = new MissingIdentifierException("clickup", 200, "task");

        assertThat(ex).isInstanceOf(RemoteServiceException.class);
        assertThat(ex.getServiceName()).isEqualTo("clickup");
        assertThat(ex.getStatusCode()).isEqualTo(200);
        assertThat(ex.getMessage()).contains("task", "status=200");
    }

    @Test
    void orchestrationAbortedExceptionShouldCarryStageAndRoute() {
        RuntimeException cause = new RuntimeException("401");
        OrchestrationAbortedException ex = new OrchestrationAbortedException("comment", "OpenCables", cause);

        assertThat(ex.getStage()).isEqualTo("comment");
        assertThat(ex.getRouteName()).isEqualTo("OpenCables");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void builderShouldFoldContextIntoMessage() {
        RemoteServiceException ex = RemoteServiceExceptionBuilder.create("ClickUp API error")
                .service("clickup")
                .status(401)
                .remoteMessage("Token invalid")
                .metadata("taskId", "abc")
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage()).isEqualTo("ClickUp API error (401): Token invalid (taskId=abc)");
        assertThat(ex.getRemoteMessage()).isEqualTo("Token invalid");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void builderShouldDefaultMissingRemoteMessage() {
        RemoteServiceException ex = RemoteServiceExceptionBuilder.create("Groq API unreachable").build();

        assertThat(ex.getMessage()).isEqualTo("Groq API unreachable: Unknown error");
        assertThat(ex.getServiceName()).isEqualTo("unknown");
        assertThat(ex.getStatusCode()).isZero();
    }

    @Test
    void builderShouldRejectEmptyMessage() {
        assertThatThrownBy(() -> RemoteServiceExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
