/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.agentflow.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for WorkflowPlan and Stage.
 */
class WorkflowPlanTest {

    @Test
    void shouldListTaskNamesInStageOrder() {
        WorkflowPlan plan = WorkflowPlan.of(Stage.of("overview"), Stage.of("risks", "budget"), Stage.of("summary"));

        assertThat(plan.taskNames()).containsExactly("overview", "risks", "budget", "summary");
        assertThat(plan.taskCount()).isEqualTo(4);
        assertThat(plan.stageIndexOf("budget")).isEqualTo(1);
        assertThat(plan.stageIndexOf("unknown")).isEqualTo(-1);
    }

    @Test
    void shouldRejectTaskInTwoStages() {
        assertThatThrownBy(() -> WorkflowPlan.of(Stage.of("overview"), Stage.of("overview", "risks")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overview");
    }

    @Test
    void shouldRejectDuplicateWithinStage() {
        assertThatThrownBy(() -> Stage.of("risks", "risks"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDropStagesEmptiedBySelection() {
        WorkflowPlan plan = WorkflowPlan.of(Stage.of("overview"), Stage.of("risks", "budget"), Stage.of("summary"));

        WorkflowPlan retained = plan.retain(Set.of("budget", "summary"));

        assertThat(retained.stages()).extracting(Stage::taskNames)
                .containsExactly(List.of("budget"), List.of("summary"));
    }

    @Test
    void shouldBuildFromNameLists() {
        WorkflowPlan plan = WorkflowPlan.fromNames(List.of(List.of("a"), List.of("b", "c")));

        assertThat(plan.stages()).hasSize(2);
        assertThat(plan.stages().get(1).contains("c")).isTrue();
        assertThat(WorkflowPlan.EMPTY.isEmpty()).isTrue();
    }
}
