package com.sagarmitra.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ToolRegistry {

    private final Map<ToolName, AgentTool> tools = new EnumMap<>(ToolName.class);

    public ToolRegistry(List<AgentTool> toolBeans) {
        log.debug("Initializing ToolRegistry with {} tool bean(s)", toolBeans.size());
        for (AgentTool tool : toolBeans) {
            AgentTool previous = tools.putIfAbsent(tool.toolName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Tool " + tool.toolName() + " is registered twice: "
                        + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
            log.debug("Registered tool '{}' ({})", tool.name(), tool.getClass().getSimpleName());
        }
    }

    public Optional<AgentTool> lookup(String name) {
        if (name == null) {
            log.debug("Tool lookup requested with null name");
            return Optional.empty();
        }
        Optional<AgentTool> tool = ToolName.fromWireName(name).map(tools::get);
        if (tool.isEmpty()) {
            log.debug("Tool '{}' not found in registry", name);
        }
        return tool;
    }

    public Optional<AgentTool> get(ToolName name) {
        return Optional.ofNullable(tools.get(name));
    }

    /** Registered tools in {@link ToolName} declaration order. */
    public List<AgentTool> tools() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }
}
