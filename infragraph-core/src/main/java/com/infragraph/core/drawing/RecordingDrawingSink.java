package com.infragraph.core.drawing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link DrawingSink} that records the primitives into a {@link DiagramStructure}.
 *
 * <p>Membership follows the latest claim: placing a member in a second container moves it.
 * A claim that would put a container inside itself or one of its own members is ignored.
 */
public class RecordingDrawingSink implements DrawingSink {

    private static final Logger log = LoggerFactory.getLogger(RecordingDrawingSink.class);

    private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
    private final Map<String, String[]> groups = new LinkedHashMap<>();
    private final Map<String, List<String>> members = new LinkedHashMap<>();
    private final Map<String, String> owner = new HashMap<>();
    private final List<DiagramEdge> edges = new ArrayList<>();

    @Override
    public void createGroup(String id, String label, String resourceType) {
        groups.putIfAbsent(id, new String[] {label, resourceType});
        members.putIfAbsent(id, new ArrayList<>());
    }

    @Override
    public void createNode(String id, String label, String resourceType) {
        nodes.putIfAbsent(id, new DiagramNode(id, label, resourceType));
    }

    @Override
    public void addMember(String groupId, String memberId) {
        if (!members.containsKey(groupId) || groupId.equals(memberId) || isAncestor(memberId, groupId)) {
            log.debug("Ignoring placement of {} in {}", memberId, groupId);
            return;
        }
        String previous = owner.put(memberId, groupId);
        if (previous != null && !previous.equals(groupId)) {
            members.get(previous).remove(memberId);
        }
        List<String> list = members.get(groupId);
        if (!list.contains(memberId)) {
            list.add(memberId);
        }
    }

    @Override
    public void connect(String originId, String destinationId, EdgeStyle style, String label) {
        edges.add(new DiagramEdge(originId, destinationId, style, label));
    }

    /**
     * Returns the recorded structure.
     *
     * @return snapshot of everything recorded so far
     */
    public DiagramStructure toStructure() {
        List<DiagramGroup> groupList = new ArrayList<>();
        groups.forEach((id, info) -> groupList.add(new DiagramGroup(id, info[0], info[1], members.get(id))));
        return new DiagramStructure(groupList, new ArrayList<>(nodes.values()), edges);
    }

    private boolean isAncestor(String candidate, String groupId) {
        String current = owner.get(groupId);
        while (current != null) {
            if (current.equals(candidate)) {
                return true;
            }
            current = owner.get(current);
        }
        return false;
    }
}
