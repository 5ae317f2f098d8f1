package com.infragraph.core.drawing;

/**
 * Receives the drawing primitives produced by the {@link RenderingTraversal}.
 *
 * <p>Primitives are identified by the resource id they were created for. The traversal creates
 * each primitive once; membership may be claimed again, in which case the latest claim wins.
 */
public interface DrawingSink {

    /**
     * Creates a container.
     *
     * @param id resource id
     * @param label display label
     * @param resourceType resource type, for styling
     */
    void createGroup(String id, String label, String resourceType);

    /**
     * Creates a leaf node.
     *
     * @param id resource id
     * @param label display label
     * @param resourceType resource type, for styling
     */
    void createNode(String id, String label, String resourceType);

    /**
     * Places a node or container inside a container.
     *
     * @param groupId container id
     * @param memberId member id
     */
    void addMember(String groupId, String memberId);

    /**
     * Connects two primitives.
     *
     * @param originId origin id
     * @param destinationId destination id
     * @param style line style
     * @param label edge label, empty for none
     */
    void connect(String originId, String destinationId, EdgeStyle style, String label);
}
