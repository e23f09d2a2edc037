package com.commandcenter.layout_service.service;

import com.commandcenter.layout_service.engine.GraphValidationException;
import com.commandcenter.layout_service.engine.LayeredLayoutEngine;
import com.commandcenter.layout_service.engine.LayoutSettings;
import com.commandcenter.layout_service.model.domain.LayoutEdge;
import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.LayoutResult;
import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeId;
import com.commandcenter.layout_service.model.domain.NodeKind;
import com.commandcenter.layout_service.model.domain.PositionedNode;
import com.commandcenter.layout_service.model.dto.LayoutEdgeDto;
import com.commandcenter.layout_service.model.dto.LayoutNodeDto;
import com.commandcenter.layout_service.model.dto.LayoutRequestDto;
import com.commandcenter.layout_service.model.dto.LayoutResponseDto;
import com.commandcenter.layout_service.model.dto.LayoutSettingsDto;
import com.commandcenter.layout_service.model.dto.PositionedNodeDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boundary between the wire format and the engine: checks the raw request shape, builds
 * domain nodes/edges, runs the layout and maps the result back onto the request's own
 * node and edge objects.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LayoutService {

    private final LayeredLayoutEngine engine;

    public LayoutResponseDto layout(LayoutRequestDto request) {
        List<LayoutNodeDto> nodeDtos = request.nodes();
        List<LayoutEdgeDto> edgeDtos = request.edges();

        List<LayoutNode> nodes = toNodes(nodeDtos);
        List<LayoutEdge> edges = toEdges(edgeDtos);

        LayoutResult result = engine.layout(nodes, edges);

        List<PositionedNodeDto> placed = new ArrayList<>(nodeDtos.size());
        for (int i = 0; i < nodeDtos.size(); i++) {
            placed.add(toPositionedDto(nodeDtos.get(i), result.nodes().get(i)));
        }
        log.debug("Layout request: {} nodes, {} edges -> {} ranks", nodes.size(), edges.size(), result.rankCount());
        return new LayoutResponseDto(placed, edgeDtos, result.rankCount(), result.width(), result.height());
    }

    public LayoutSettingsDto settings() {
        LayoutSettings settings = engine.getSettings();
        Map<String, LayoutSettingsDto.BoxDto> table = new LinkedHashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            table.put(kind.name(), toBox(engine.dimensionResolver().dimensions(kind)));
        }
        return new LayoutSettingsDto(
                settings.rankGap(),
                settings.nodeGap(),
                table,
                toBox(settings.defaultDimensions()),
                settings.maxNodes(),
                settings.maxEdges(),
                settings.cyclePolicy().name(),
                settings.crossingSweeps()
        );
    }

    private static List<LayoutNode> toNodes(List<LayoutNodeDto> dtos) {
        List<LayoutNode> nodes = new ArrayList<>(dtos.size());
        for (int i = 0; i < dtos.size(); i++) {
            LayoutNodeDto dto = dtos.get(i);
            if (dto == null) {
                throw new GraphValidationException("nodes[" + i + "] is null");
            }
            nodes.add(new LayoutNode(requireId(dto.id(), "nodes[" + i + "].id"), NodeKind.fromWire(dto.kind())));
        }
        return nodes;
    }

    private static List<LayoutEdge> toEdges(List<LayoutEdgeDto> dtos) {
        List<LayoutEdge> edges = new ArrayList<>(dtos.size());
        for (int i = 0; i < dtos.size(); i++) {
            LayoutEdgeDto dto = dtos.get(i);
            if (dto == null) {
                throw new GraphValidationException("edges[" + i + "] is null");
            }
            edges.add(new LayoutEdge(
                    requireId(dto.source(), "edges[" + i + "].source"),
                    requireId(dto.target(), "edges[" + i + "].target")));
        }
        return edges;
    }

    private static NodeId requireId(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new GraphValidationException(field + " must not be null or blank");
        }
        return NodeId.of(raw);
    }

    private static PositionedNodeDto toPositionedDto(LayoutNodeDto dto, PositionedNode node) {
        return new PositionedNodeDto(
                dto.id(),
                dto.kind(),
                dto.data(),
                node.rank(),
                new PositionedNodeDto.PositionDto(node.position().x(), node.position().y()),
                node.dimensions().width(),
                node.dimensions().height()
        );
    }

    private static LayoutSettingsDto.BoxDto toBox(NodeDimensions dimensions) {
        return new LayoutSettingsDto.BoxDto(dimensions.width(), dimensions.height());
    }
}
