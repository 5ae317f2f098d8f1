package com.infragraph.core.handler.aws;

import com.infragraph.core.handler.HandlerTestBase;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SecurityGroupHandler}.
 */
class SecurityGroupHandlerTest extends HandlerTestBase {

    private final SecurityGroupHandler handler = new SecurityGroupHandler();

    @Test
    void apply_protectedInstance_groupWrapsInstanceInsideSubnet() {
        // Given
        edges("aws_vpc.main", "aws_subnet.a", "aws_security_group.web");
        edges("aws_subnet.a", "aws_instance.web");
        edges("aws_instance.web", "aws_security_group.web");

        // When
        handler.apply(graph, AWS);

        // Then
        assertThat(graph.connections("aws_subnet.a")).containsExactly("aws_security_group.web");
        assertThat(graph.connections("aws_security_group.web")).containsExactly("aws_instance.web");
        assertThat(graph.connections("aws_instance.web")).isEmpty();
        assertThat(graph.connections("aws_vpc.main")).containsExactly("aws_subnet.a");
    }

    @Test
    void apply_unusedGroup_isRemoved() {
        edges("aws_vpc.main", "aws_security_group.unused", "aws_security_group.web");
        edges("aws_instance.web", "aws_security_group.web");

        handler.apply(graph, AWS);

        assertThat(graph.contains("aws_security_group.unused")).isFalse();
        assertThat(graph.contains("aws_security_group.web")).isTrue();
    }

    @Test
    void apply_groupHoldingOnlyEmptyGroup_isRemovedToo() {
        // Given
        edges("aws_vpc.main", "aws_security_group.a", "aws_security_group.b");
        edges("aws_security_group.a", "aws_security_group.b");
        edges("aws_subnet.s", "aws_instance.web");
        edges("aws_instance.web", "aws_security_group.web");

        // When
        handler.apply(graph, AWS);

        // Then
        assertThat(graph.contains("aws_security_group.b")).isFalse();
        assertThat(graph.contains("aws_security_group.a")).isFalse();
        assertThat(graph.connections("aws_vpc.main")).isEmpty();
        assertThat(graph.connections("aws_security_group.web")).containsExactly("aws_instance.web");
    }

    @Test
    void apply_result_leavesNoGroupWithoutVisibleMembers() {
        edges("aws_subnet.a", "aws_instance.web", "aws_instance.db");
        edges("aws_instance.web", "aws_security_group.web");
        edges("aws_instance.db", "aws_security_group.db");
        edges("aws_security_group.hidden_only", "aws_security_group_rule.egress");
        edges("aws_security_group_rule.egress");
        graph.hide("aws_security_group_rule.egress");

        handler.apply(graph, AWS);

        for (String group : graph.findNodes(id -> id.startsWith("aws_security_group."))) {
            assertThat(graph.connections(group))
                .as("members of %s", group)
                .anyMatch(member -> !graph.isHidden(member));
        }
    }

    @Test
    void apply_instanceInTwoGroups_copiedSoEachWrapperHoldsOne() {
        edges("aws_subnet.a", "aws_instance.app");
        edges("aws_instance.app", "aws_security_group.a", "aws_security_group.b");
        meta("aws_instance.app", Map.of("ami", "ami-1"));

        handler.apply(graph, AWS);

        assertThat(graph.connections("aws_security_group.a")).containsExactly("aws_instance.app");
        assertThat(graph.connections("aws_security_group.b")).containsExactly("aws_instance.app_2");
        assertThat(graph.metadata("aws_instance.app_2")).containsEntry("ami", "ami-1");
        assertThat(graph.connections("aws_subnet.a"))
            .containsExactly("aws_security_group.a", "aws_security_group.b");
    }

    @Test
    void apply_secondMemberOfPopulatedGroup_getsOwnWrapper() {
        edges("aws_instance.x", "aws_security_group.shared");
        edges("aws_instance.y", "aws_security_group.shared");
        meta("aws_security_group.shared", Map.of("description", "shared"));

        handler.apply(graph, AWS);

        assertThat(graph.connections("aws_security_group.shared")).containsExactly("aws_instance.x");
        assertThat(graph.connections("aws_security_group.shared_y")).containsExactly("aws_instance.y");
        assertThat(graph.metadata("aws_security_group.shared_y")).containsEntry("description", "shared");
    }

    @Test
    void apply_numberedMember_getsSameNumberedWrapper() {
        edges("aws_subnet.a~2", "aws_instance.web~2");
        edges("aws_instance.web~2", "aws_security_group.web");
        edges("aws_instance.other", "aws_security_group.web");

        handler.apply(graph, AWS);

        assertThat(graph.connections("aws_security_group.web~2")).containsExactly("aws_instance.web~2");
        assertThat(graph.connections("aws_subnet.a~2")).containsExactly("aws_security_group.web~2");
    }

    @Test
    void apply_ruleEdge_replacedByRuleTarget() {
        edges("aws_security_group.web", "aws_security_group_rule.ingress");
        edges("aws_security_group_rule.ingress", "aws_instance.db");

        handler.apply(graph, AWS);

        assertThat(graph.connections("aws_security_group.web")).containsExactly("aws_instance.db");
    }
}
