package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayoutSettingsTest {

    @Test
    void defaultsMatchTheCanvas() {
        LayoutSettings settings = LayoutSettings.defaults();

        assertThat(settings.rankGap()).isEqualTo(120);
        assertThat(settings.nodeGap()).isEqualTo(150);
        assertThat(settings.dimensions()).containsOnlyKeys(NodeKind.FILE_GROUP);
        assertThat(settings.cyclePolicy()).isEqualTo(CyclePolicy.FALLBACK);
        assertThat(settings.crossingSweeps()).isEqualTo(1);
    }

    @Test
    void rejectsBadValues() {
        LayoutSettings settings = LayoutSettings.defaults();

        assertThatThrownBy(() -> settings.withGaps(120, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withGaps(-1, 150)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withCrossingSweeps(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withLimits(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NodeDimensions(0, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dimensionTableIsCopied() {
        Map<NodeKind, NodeDimensions> table = new EnumMap<>(NodeKind.class);
        table.put(NodeKind.AGENT, new NodeDimensions(10, 10));
        LayoutSettings settings = LayoutSettings.defaults();
        LayoutSettings custom = new LayoutSettings(settings.rankGap(), settings.nodeGap(), table,
                settings.defaultDimensions(), 10, 10, CyclePolicy.REJECT, 2);

        table.clear();

        assertThat(custom.dimensions()).containsKey(NodeKind.AGENT);
        assertThatThrownBy(() -> custom.dimensions().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
