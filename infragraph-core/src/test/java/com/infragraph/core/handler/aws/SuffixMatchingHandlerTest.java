package com.infragraph.core.handler.aws;

import com.infragraph.core.handler.HandlerTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SuffixMatchingHandler}.
 */
class SuffixMatchingHandlerTest extends HandlerTestBase {

    private final SuffixMatchingHandler handler = new SuffixMatchingHandler();

    @Test
    void matchZonesToSubnets_numberedZone_keepsOnlySameNumberedSubnets() {
        edges("aws_az.zone~1", "aws_subnet.a~1", "aws_subnet.a~2", "aws_subnet.shared");

        handler.matchZonesToSubnets(graph);

        assertThat(graph.connections("aws_az.zone~1")).containsExactly("aws_subnet.a~1", "aws_subnet.shared");
    }

    @Test
    void matchSecurityGroupsToSubnets_numberedSubnet_swapsToSameNumberedGroup() {
        edges("aws_subnet.a~2", "aws_security_group.web~1", "aws_instance.x");
        edges("aws_security_group.web~2");

        handler.matchSecurityGroupsToSubnets(graph);

        assertThat(graph.connections("aws_subnet.a~2")).containsExactly("aws_instance.x", "aws_security_group.web~2");
    }

    @Test
    void linkInstancesToRoles_throughProfile_skipsPolicies() {
        edges("aws_instance.web", "aws_iam_instance_profile.web");
        edges("aws_iam_instance_profile.web", "aws_iam_role.web");
        edges("aws_iam_role.web_policy", "aws_iam_instance_profile.web");

        handler.linkInstancesToRoles(graph);

        assertThat(graph.connections("aws_instance.web"))
            .containsExactly("aws_iam_instance_profile.web", "aws_iam_role.web");
    }

    @Test
    void splitNatGateways_publicSubnets_eachGetOwnGateway() {
        // Given
        edges("aws_subnet.public~1", "aws_nat_gateway.main");
        edges("aws_subnet.public~2", "aws_nat_gateway.main");
        edges("aws_route_table.private~2", "aws_nat_gateway.main");
        edges("aws_route_table.shared", "aws_nat_gateway.main");
        edges("aws_nat_gateway.main", "aws_internet_gateway.igw");

        // When
        handler.splitNatGateways(graph);

        // Then
        assertThat(graph.contains("aws_nat_gateway.main")).isFalse();
        assertThat(graph.connections("aws_subnet.public~1")).containsExactly("aws_nat_gateway.main~1");
        assertThat(graph.connections("aws_subnet.public~2")).containsExactly("aws_nat_gateway.main~2");
        assertThat(graph.connections("aws_route_table.private~2")).containsExactly("aws_nat_gateway.main~2");
        assertThat(graph.connections("aws_route_table.shared"))
            .containsExactly("aws_nat_gateway.main~1", "aws_nat_gateway.main~2");
        assertThat(graph.connections("aws_nat_gateway.main~1")).containsExactly("aws_internet_gateway.igw");
        assertThat(graph.count("aws_nat_gateway.main~2")).isEqualTo(1);
    }

    @Test
    void splitNatGateways_privateSubnetsOnly_leavesGatewayAlone() {
        edges("aws_subnet.private~1", "aws_nat_gateway.main");

        handler.splitNatGateways(graph);

        assertThat(graph.connections("aws_subnet.private~1")).containsExactly("aws_nat_gateway.main");
    }

    @Test
    void dropZonedSubnetsFromVpcs_subnetUnderZone_removedFromVpc() {
        edges("aws_vpc.main", "aws_subnet.a", "aws_subnet.b", "aws_az.zone~1");
        edges("aws_az.zone~1", "aws_subnet.a");

        handler.dropZonedSubnetsFromVpcs(graph);

        assertThat(graph.connections("aws_vpc.main")).containsExactly("aws_subnet.b", "aws_az.zone~1");
    }
}
