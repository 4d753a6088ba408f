package com.nexuscontrol.api;

import com.nexuscontrol.dispatch.AdapterRegistry;
import com.nexuscontrol.dispatch.DispatchAdapter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/adapters")
public class AdapterController {

    private final AdapterRegistry adapterRegistry;

    public AdapterController(AdapterRegistry adapterRegistry) {
        this.adapterRegistry = adapterRegistry;
    }

    @GetMapping
    public List<Map<String, Object>> list() {
        return adapterRegistry.list().stream()
            .map(AdapterController::describe)
            .toList();
    }

    private static Map<String, Object> describe(DispatchAdapter adapter) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("adapter_id", adapter.adapterId());
        view.put("kind", adapter.adapterKind());
        view.put("capabilities", adapter.capabilities().stream().sorted().toList());
        view.put("manifest", adapter.manifest());
        return view;
    }
}
