package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.NodeId;
import lombok.Getter;

import java.util.List;

/** Raised under {@link CyclePolicy#REJECT} when some nodes can never be ranked. */
@Getter
public class CyclicGraphException extends LayoutException {

    private final List<NodeId> unrankedNodes;

    public CyclicGraphException(List<NodeId> unrankedNodes) {
        super("Graph contains a cycle: cannot rank node(s) " + unrankedNodes);
        this.unrankedNodes = List.copyOf(unrankedNodes);
    }
}
