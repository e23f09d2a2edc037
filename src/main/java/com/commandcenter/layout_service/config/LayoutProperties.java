package com.commandcenter.layout_service.config;

import com.commandcenter.layout_service.engine.CyclePolicy;
import com.commandcenter.layout_service.engine.LayoutSettings;
import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds {@code layout.*} from application.properties. Converted once into an immutable
 * {@link LayoutSettings}, which is what the engine actually receives.
 */
@Data
@ConfigurationProperties(prefix = "layout")
public class LayoutProperties {

    private double rankGap = LayoutSettings.DEFAULT_RANK_GAP;

    private double nodeGap = LayoutSettings.DEFAULT_NODE_GAP;

    // Keyed by node kind in wire spelling, e.g. layout.dimensions.file-group.width=240
    private Map<String, Box> dimensions = new LinkedHashMap<>(Map.of(
            "file-group", new Box(LayoutSettings.FILE_GROUP_DIMENSIONS.width(), LayoutSettings.FILE_GROUP_DIMENSIONS.height())
    ));

    private Box defaultDimensions = new Box(
            LayoutSettings.DEFAULT_NODE_DIMENSIONS.width(), LayoutSettings.DEFAULT_NODE_DIMENSIONS.height());

    private int maxNodes = LayoutSettings.DEFAULT_MAX_NODES;

    private int maxEdges = LayoutSettings.DEFAULT_MAX_EDGES;

    private CyclePolicy cyclePolicy = CyclePolicy.FALLBACK;

    private int crossingSweeps = 1;

    public LayoutSettings toSettings() {
        Map<NodeKind, NodeDimensions> table = new EnumMap<>(NodeKind.class);
        dimensions.forEach((kind, box) -> table.put(NodeKind.parseStrict(kind), box.toDimensions()));
        return new LayoutSettings(
                rankGap,
                nodeGap,
                table,
                defaultDimensions.toDimensions(),
                maxNodes,
                maxEdges,
                cyclePolicy,
                crossingSweeps
        );
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Box {
        private double width;
        private double height;

        NodeDimensions toDimensions() {
            return new NodeDimensions(width, height);
        }
    }
}
