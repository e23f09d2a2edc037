package com.commandcenter.layout_service;

import com.commandcenter.layout_service.engine.CyclePolicy;
import com.commandcenter.layout_service.engine.LayeredLayoutEngine;
import com.commandcenter.layout_service.model.domain.NodeKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "layout.cycle-policy=REJECT",
        "layout.crossing-sweeps=3",
        "layout.dimensions.decision.width=320",
        "layout.dimensions.decision.height=120"
})
class LayoutServiceApplicationTests {

    @Autowired
    private LayeredLayoutEngine engine;

    @Test
    void bindsLayoutPropertiesIntoTheEngine() {
        assertThat(engine.getSettings().cyclePolicy()).isEqualTo(CyclePolicy.REJECT);
        assertThat(engine.getSettings().crossingSweeps()).isEqualTo(3);
        assertThat(engine.dimensionResolver().dimensions(NodeKind.DECISION).width()).isEqualTo(320);
        // file-group entry from application.properties survives alongside the override
        assertThat(engine.dimensionResolver().dimensions(NodeKind.FILE_GROUP).width()).isEqualTo(240);
    }
}
