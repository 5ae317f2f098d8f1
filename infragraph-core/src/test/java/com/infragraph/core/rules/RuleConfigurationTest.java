package com.infragraph.core.rules;

import com.infragraph.core.exception.ProviderLoadException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RuleConfiguration} and {@link RuleConfigurationLoader}.
 */
class RuleConfigurationTest {

    @Test
    void load_awsRules_bindsTables() {
        RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

        assertThat(aws.provider()).isEqualTo("aws");
        assertThat(aws.groupNodes()).startsWith("aws_vpc", "aws_az");
        assertThat(aws.sharedServicesGroup()).isEqualTo("aws_group.shared_services");
        assertThat(aws.handlersFor("aws_security_group")).containsExactly("aws-security-group");
        assertThat(aws.autoAnnotations()).anySatisfy(a -> {
            assertThat(a.prefix()).isEqualTo("aws_route53");
            assertThat(a.arrow()).isEqualTo(RuleConfiguration.Arrow.REVERSE);
        });
        assertThat(aws.multiInstancePatterns()).first()
            .satisfies(p -> assertThat(p.triggerAttributes()).containsExactly("subnets"));
    }

    @Test
    void load_missingResource_throwsProviderLoadException() {
        assertThatThrownBy(() -> RuleConfigurationLoader.load("oci", "providers/oci.yaml"))
            .isInstanceOf(ProviderLoadException.class)
            .hasMessageContaining("provider=oci");
    }

    @Test
    void tables_areReadOnly() {
        RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

        assertThatThrownBy(() -> aws.groupNodes().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> aws.nodeVariants().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void consolidatedNameFor_moduleId_usesFirstMatchingPrefix() {
        RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

        assertThat(aws.consolidatedNameFor("module.dns.aws_route53_zone.main")).contains("aws_route53_record.route_53");
        assertThat(aws.consolidatedNameFor("aws_instance.web")).isEmpty();
    }

    @Test
    void variantFor_firstDeclaredKeywordWins() {
        RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

        assertThat(aws.variantFor("aws_lb.web", "{load_balancer_type=network, internal=application}"))
            .contains("aws_alb");
        assertThat(aws.variantFor("aws_lb.web", "{}")).isEmpty();
    }

    @Test
    void merge_twoProviders_concatenatesWithoutDuplicatesAndFirstKeyWins() {
        RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");
        RuleConfiguration azure = RuleConfigurationLoader.load("azure", "providers/azure.yaml");

        RuleConfiguration merged = RuleConfiguration.merge(List.of(aws, azure));

        assertThat(merged.provider()).isEqualTo("aws+azure");
        assertThat(merged.groupNodes()).containsSubsequence("aws_vpc", "azurerm_virtual_network");
        assertThat(merged.groupNodes()).doesNotHaveDuplicates();
        assertThat(merged.sharedServicesGroup()).isEqualTo(aws.sharedServicesGroup());
        assertThat(merged.specialResources()).containsAll(azure.specialResources()).doesNotHaveDuplicates();
    }

    @Test
    void merge_singleOrEmpty_returnsInputOrEmpty() {
        RuleConfiguration gcp = RuleConfigurationLoader.load("gcp", "providers/gcp.yaml");

        assertThat(RuleConfiguration.merge(List.of(gcp))).isSameAs(gcp);
        assertThat(RuleConfiguration.merge(List.of()).groupNodes()).isEmpty();
    }

    @Test
    void hasAutoAnnotation_linkTargetType_isRecognized() {
        RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

        assertThat(aws.hasAutoAnnotation("tv_aws_users")).isTrue();
        assertThat(aws.hasAutoAnnotation("aws_route53_record")).isTrue();
        assertThat(aws.hasAutoAnnotation("aws_s3_bucket")).isFalse();
    }
}
