package com.example.metaindex;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    @Autowired
    private ToolRegistry toolRegistry;

    /** registers the tools, returning their ids in request order; known tools keep their id */
    @PostMapping
    public List<ApiModels.ToolView> register(@RequestBody List<ApiModels.ToolRequest> tools) {
        List<ToolSpec> specs = new ArrayList<>();
        for (ApiModels.ToolRequest t : tools) specs.add(new ToolSpec(t.getName(), t.getVersion(), t.getConfiguration()));
        List<ApiModels.ToolView> out = new ArrayList<>();
        for (IndexerTool t : toolRegistry.registerAll(specs)) out.add(ApiModels.ToolView.of(t));
        return out;
    }

    @GetMapping("/{id}")
    public ApiModels.ToolView get(@PathVariable("id") long id) {
        return toolRegistry.findById(id)
                .map(ApiModels.ToolView::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no tool " + id));
    }
}
