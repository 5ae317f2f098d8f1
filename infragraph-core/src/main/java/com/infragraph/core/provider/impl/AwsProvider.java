package com.infragraph.core.provider.impl;

import com.infragraph.core.handler.HandlerSet;
import com.infragraph.core.handler.aws.ApiGatewayHandler;
import com.infragraph.core.handler.aws.AutoscalingHandler;
import com.infragraph.core.handler.aws.CloudFrontOriginHandler;
import com.infragraph.core.handler.aws.DbSubnetGroupHandler;
import com.infragraph.core.handler.aws.EcsClusterHandler;
import com.infragraph.core.handler.aws.EfsHandler;
import com.infragraph.core.handler.aws.EksClusterHandler;
import com.infragraph.core.handler.aws.ElastiCacheHandler;
import com.infragraph.core.handler.aws.LambdaEventSourceHandler;
import com.infragraph.core.handler.aws.LoadBalancerHandler;
import com.infragraph.core.handler.aws.S3NotificationHandler;
import com.infragraph.core.handler.aws.SecurityGroupHandler;
import com.infragraph.core.handler.aws.SqsQueuePolicyHandler;
import com.infragraph.core.handler.aws.SubnetAvailabilityZoneHandler;
import com.infragraph.core.handler.aws.SubnetExpansionHandler;
import com.infragraph.core.handler.aws.SuffixMatchingHandler;
import com.infragraph.core.handler.aws.VpcEndpointHandler;
import com.infragraph.core.handler.common.RandomStringHandler;
import com.infragraph.core.handler.common.SharedServicesHandler;
import com.infragraph.core.provider.ProviderDescriptor;
import com.infragraph.core.provider.ProviderPlugin;

import java.util.List;

/**
 * Amazon Web Services. The default provider for identifiers no other provider claims.
 */
public class AwsProvider implements ProviderPlugin {

    public static final String ID = "aws";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Amazon Web Services";
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(ID, getDisplayName(), List.of("aws_"), List.of("aws"),
            "providers/aws.yaml", AwsProvider::handlers);
    }

    @Override
    public boolean isDefault() {
        return true;
    }

    static HandlerSet handlers() {
        return HandlerSet.of(
            new SqsQueuePolicyHandler(),
            new CloudFrontOriginHandler(),
            new SubnetAvailabilityZoneHandler(),
            new EcsClusterHandler(),
            SubnetExpansionHandler.autoscalingGroups(),
            SubnetExpansionHandler.eksNodeGroups(),
            SubnetExpansionHandler.eksFargateProfiles(),
            new EksClusterHandler(),
            new ElastiCacheHandler(),
            new LambdaEventSourceHandler(),
            new ApiGatewayHandler(),
            new S3NotificationHandler(),
            new AutoscalingHandler(),
            new EfsHandler(),
            new DbSubnetGroupHandler(),
            new SecurityGroupHandler(),
            new LoadBalancerHandler(),
            new VpcEndpointHandler(),
            new SharedServicesHandler(),
            new RandomStringHandler(),
            new SuffixMatchingHandler()
        );
    }
}
