package com.sagarmitra.tools;

import java.util.Map;

public interface AgentTool {

    /** Argument carrying the id of the user whose turn invoked the tool. */
    String USER_ID_ARG = "user_id";

    ToolName toolName();

    default String name() {
        return toolName().wireName();
    }

    String description();

    /** JSON schema of the arguments object, as a nested map. */
    Map<String, Object> parametersSchema();

    /**
     * Whether the tool reads per-user data. Such tools get {@link #USER_ID_ARG} from the turn,
     * never from the model.
     */
    default boolean userScoped() {
        return false;
    }

    ToolResult execute(Map<String, Object> args) throws Exception;
}
