package com.infragraph.core.handler.aws;

import com.infragraph.core.handler.HandlerTestBase;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LoadBalancerHandler}.
 */
class LoadBalancerHandlerTest extends HandlerTestBase {

    private final LoadBalancerHandler handler = new LoadBalancerHandler();

    @Test
    void apply_applicationType_foldsIntoAlbVariant() {
        // Given
        meta("aws_lb.web", Map.of("load_balancer_type", "application"));
        edges("aws_lb.web", "aws_ecs_service.api", "aws_acm_certificate.cert");
        edges("aws_security_group.lb", "aws_lb.web");
        edges("aws_vpc.main", "aws_lb.web");

        // When
        handler.apply(graph, AWS);

        // Then
        assertThat(graph.connections("aws_alb.web")).containsExactly("aws_ecs_service.api");
        assertThat(graph.connections("aws_lb.web")).containsExactly("aws_acm_certificate.cert", "aws_alb.web");
        assertThat(graph.connections("aws_security_group.lb")).containsExactly("aws_alb.web");
        assertThat(graph.connections("aws_vpc.main")).containsExactly("aws_lb.web");
        assertThat(graph.metadata("aws_alb.web")).containsEntry("load_balancer_type", "application");
    }

    @Test
    void apply_networkType_foldsIntoNlbVariant() {
        meta("aws_lb.tcp", Map.of("load_balancer_type", "network"));
        edges("aws_lb.tcp", "aws_instance.app");

        handler.apply(graph, AWS);

        assertThat(graph.connections("aws_nlb.tcp")).containsExactly("aws_instance.app");
    }

    @Test
    void apply_noKeyword_fallsBackToFirstDeclaredVariant() {
        edges("aws_lb.plain", "aws_instance.app");

        handler.apply(graph, AWS);

        assertThat(graph.contains("aws_alb.plain")).isTrue();
    }

    @Test
    void apply_targetWithCount_propagatesCountToSecurityGroupParent() {
        meta("aws_lb.web", Map.of("load_balancer_type", "application"));
        meta("aws_ecs_service.api", Map.of("count", 3));
        edges("aws_lb.web", "aws_ecs_service.api");
        edges("aws_security_group.lb", "aws_lb.web");

        handler.apply(graph, AWS);

        assertThat(graph.count("aws_alb.web")).isEqualTo(3);
        assertThat(graph.count("aws_security_group.lb")).isEqualTo(3);
    }

    @Test
    void apply_existingHigherCount_isNotDowngraded() {
        meta("aws_lb.web", Map.of("load_balancer_type", "application", "count", 4));
        meta("aws_ecs_service.api", Map.of("count", 2));
        edges("aws_lb.web", "aws_ecs_service.api");

        handler.apply(graph, AWS);

        assertThat(graph.count("aws_alb.web")).isEqualTo(4);
    }

    @Test
    void apply_classicElb_foldsIntoSingleNode() {
        edges("aws_elb.legacy", "aws_instance.app");

        handler.apply(graph, AWS);

        assertThat(graph.connections("aws_elb.elb")).containsExactly("aws_instance.app");
        assertThat(graph.connections("aws_elb.legacy")).containsExactly("aws_elb.elb");
    }
}
