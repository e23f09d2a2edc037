package com.commandcenter.layout_service.controller;

import com.commandcenter.layout_service.model.dto.LayoutRequestDto;
import com.commandcenter.layout_service.model.dto.LayoutResponseDto;
import com.commandcenter.layout_service.model.dto.LayoutSettingsDto;
import com.commandcenter.layout_service.service.LayoutService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/layout")
@RequiredArgsConstructor
public class LayoutController {

    private final LayoutService layoutService;

    // The canvas posts its current nodes + edges every time the topology changes
    @PostMapping
    public LayoutResponseDto layout(@RequestBody LayoutRequestDto request) {
        return layoutService.layout(request);
    }

    @GetMapping("/settings")
    public LayoutSettingsDto settings() {
        return layoutService.settings();
    }
}
