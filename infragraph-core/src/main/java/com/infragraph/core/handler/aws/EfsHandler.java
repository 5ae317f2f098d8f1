package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;

/**
 * Groups EFS mount targets under their file system.
 */
public class EfsHandler extends AbstractResourceHandler {

    private static final String MOUNT_TARGET_TYPE = "aws_efs_mount_target";
    private static final String FILE_SYSTEM_PREFIX = "aws_efs_file_system";

    @Override
    public String getId() {
        return "aws-efs";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String target : graph.findNodes(id -> hasType(id, MOUNT_TARGET_TYPE))) {
            for (String connection : List.copyOf(graph.connections(target))) {
                if (startsWith(connection, FILE_SYSTEM_PREFIX)) {
                    graph.connect(connection, target);
                    graph.disconnect(target, connection);
                }
            }
        }
        for (String fileSystem : graph.nodesStartingWith(FILE_SYSTEM_PREFIX)) {
            if (!graph.hasMetadata(fileSystem)) {
                graph.setCount(fileSystem, 1);
            }
        }
    }
}
