package com.phillippitts.meetingrouter.service.routing;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.domain.DestinationRoute;
import com.phillippitts.meetingrouter.domain.DestinationRoute.TaskRouting;
import com.phillippitts.meetingrouter.exception.MissingCredentialException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigResolutionChainTest {

    private static ClickUpProperties globals(String token, String listId, String status, String assigneeIds,
                                             String legacyAssignee, String threshold, String enabled) {
        return new ClickUpProperties(null, token, null, null, listId, status, assigneeIds, legacyAssignee,
                threshold, enabled, null, null);
    }

    private static DestinationRoute route(String token, String listId, TaskRouting taskRouting) {
        return new DestinationRoute("R", List.of("r"), "T1", token, null, null, listId, taskRouting);
    }

    private static TaskRouting taskRouting(Boolean enabled, String listId, String status, List<Long> assignees,
                                           Double threshold) {
        return new TaskRouting(enabled, listId, "S1", null, status, assignees, threshold);
    }

    @Test
    void routeTokenOverridesGlobalToken() {
        ConfigResolutionChain chain = new ConfigResolutionChain(ClickUpProperties.of("pk_global", null, null, null));

        assertThat(chain.resolveApiToken(route("pk_route", null, null))).isEqualTo("pk_route");
        assertThat(chain.resolveApiToken(route(null, null, null))).isEqualTo("pk_global");
    }

    @Test
    void missingTokenIsAnError() {
        ConfigResolutionChain chain = new ConfigResolutionChain(ClickUpProperties.of(null, null, null, null));

        assertThatThrownBy(() -> chain.resolveApiToken(route(null, null, null)))
                .isInstanceOf(MissingCredentialException.class)
                .hasMessageContaining("'R'");
    }

    @Test
    void listIdFallsThroughTaskRoutingThenRouteThenGlobal() {
        ConfigResolutionChain chain = new ConfigResolutionChain(ClickUpProperties.of("pk", null, null, "L-GLOBAL"));

        assertThat(chain.resolveTaskListId(route(null, "L-ROUTE", taskRouting(null, "L-TASK", null, null, null))))
                .contains("L-TASK");
        assertThat(chain.resolveTaskListId(route(null, "L-ROUTE", null))).contains("L-ROUTE");
        assertThat(chain.resolveTaskListId(route(null, null, null))).contains("L-GLOBAL");
    }

    @Test
    void noListIdMeansSkip() {
        ConfigResolutionChain chain = new ConfigResolutionChain(ClickUpProperties.of("pk", null, null, null));

        assertThat(chain.resolveTaskListId(route(null, null, null))).isEmpty();
    }

    @Test
    void spaceIdComesFromTaskRouting() {
        ConfigResolutionChain chain = new ConfigResolutionChain(ClickUpProperties.of("pk", null, null, null));

        assertThat(chain.resolveTaskSpaceId(route(null, null, taskRouting(null, null, null, null, null))))
                .contains("S1");
        assertThat(chain.resolveTaskFolderId(route(null, null, null))).isEmpty();
    }

    @Test
    void statusFallsBackToBacklog() {
        ConfigResolutionChain withGlobal = new ConfigResolutionChain(
                globals("pk", null, "in progress", null, null, null, null));
        ConfigResolutionChain withoutGlobal = new ConfigResolutionChain(ClickUpProperties.of("pk", null, null, null));

        assertThat(withGlobal.resolveTaskStatus(route(null, null, taskRouting(null, null, "review", null, null))))
                .isEqualTo("review");
        assertThat(withGlobal.resolveTaskStatus(route(null, null, null))).isEqualTo("in progress");
        assertThat(withoutGlobal.resolveTaskStatus(route(null, null, null))).isEqualTo("backlog");
    }

    @Test
    void assigneesPreferNonEmptyRouteList() {
        ConfigResolutionChain chain = new ConfigResolutionChain(
                globals("pk", null, null, "11, 12", null, null, null));

        assertThat(chain.resolveAssigneeIds(route(null, null, taskRouting(null, null, null, List.of(5L, -1L), null))))
                .containsExactly(5L);
        assertThat(chain.resolveAssigneeIds(route(null, null, taskRouting(null, null, null, List.of(), null))))
                .containsExactly(11L, 12L);
    }

    @Test
    void globalAssigneesFilterToPositiveIntegers() {
        assertThat(ConfigResolutionChain.parseGlobalAssignees("1, abc, -3, 0, 42,", null)).containsExactly(1L, 42L);
        assertThat(ConfigResolutionChain.parseGlobalAssignees(null, "77")).containsExactly(77L);
        assertThat(ConfigResolutionChain.parseGlobalAssignees(" ", null)).isEmpty();
    }

    @Test
    void thresholdIsAlwaysClampedToUnitInterval() {
        ConfigResolutionChain chain = new ConfigResolutionChain(globals("pk", null, null, null, null, "7", null));

        assertThat(chain.resolveConfidenceThreshold(route(null, null, null))).isEqualTo(1.0);
        assertThat(chain.resolveConfidenceThreshold(route(null, null, taskRouting(null, null, null, null, -2.0))))
                .isEqualTo(0.0);
        assertThat(chain.resolveConfidenceThreshold(route(null, null, taskRouting(null, null, null, null, 0.3))))
                .isEqualTo(0.3);
        assertThat(chain.resolveConfidenceThreshold(
                route(null, null, taskRouting(null, null, null, null, Double.NaN)))).isEqualTo(1.0);
    }

    @Test
    void nonNumericGlobalThresholdUsesDefault() {
        assertThat(ConfigResolutionChain.parseThreshold("high")).isEqualTo(0.5);
        assertThat(ConfigResolutionChain.parseThreshold(null)).isEqualTo(0.5);
        assertThat(ConfigResolutionChain.parseThreshold("Infinity")).isEqualTo(0.5);
        assertThat(ConfigResolutionChain.parseThreshold("-0.4")).isEqualTo(0.0);
        assertThat(ConfigResolutionChain.parseThreshold(" 0.65 ")).isEqualTo(0.65);
    }

    @Test
    void taskCreationFlagRecognizesDisabledWords() {
        assertThat(ConfigResolutionChain.parseEnabledFlag(null)).isTrue();
        assertThat(ConfigResolutionChain.parseEnabledFlag("true")).isTrue();
        assertThat(ConfigResolutionChain.parseEnabledFlag("yes")).isTrue();
        assertThat(ConfigResolutionChain.parseEnabledFlag("FALSE")).isFalse();
        assertThat(ConfigResolutionChain.parseEnabledFlag("0")).isFalse();
        assertThat(ConfigResolutionChain.parseEnabledFlag(" No ")).isFalse();
        assertThat(ConfigResolutionChain.parseEnabledFlag("off")).isFalse();
    }

    @Test
    void routeFlagOverridesGlobalFlag() {
        ConfigResolutionChain disabledGlobally = new ConfigResolutionChain(
                globals("pk", null, null, null, null, null, "off"));

        assertThat(disabledGlobally.isTaskCreationEnabled(route(null, null, null))).isFalse();
        assertThat(disabledGlobally.isTaskCreationEnabled(
                route(null, null, taskRouting(true, null, null, null, null)))).isTrue();
    }
}
