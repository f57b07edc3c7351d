package com.agentrelay.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Typed view over the {@code data} payload of an {@code item.*} event.
 * <p>
 * Only the fields relevant to the declared {@link ItemKind} are populated; the rest are null.
 * The original payload is kept in {@link #data()} for anything not modelled here.
 *
 * @param kind        the item kind, {@link ItemKind#OTHER} for unrecognised kinds
 * @param kindName    the raw kind string as sent by the worker
 * @param path        file path for file changes
 * @param operation   file operation (add, update, delete) for file changes
 * @param command     command line for command executions
 * @param exitCode    exit code of a finished command execution
 * @param text        message text for agent messages and reasoning
 * @param description free-form description supplied by the worker
 * @param data        the raw payload node, never null
 */
public record ItemPayload(
        ItemKind kind,
        String kindName,
        String path,
        String operation,
        String command,
        Integer exitCode,
        String text,
        String description,
        JsonNode data
) {

    public ItemPayload {
        if (kind == null) {
            kind = ItemKind.OTHER;
        }
        if (data == null) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    public static ItemPayload empty() {
        return from(null);
    }

    public static ItemPayload fileChange(String path, String operation) {
        return new ItemPayload(ItemKind.FILE_CHANGE, "file_change", path, operation,
                null, null, null, null, null);
    }

    public static ItemPayload command(String command, Integer exitCode) {
        return new ItemPayload(ItemKind.COMMAND_EXECUTION, "command_execution", null, null,
                command, exitCode, null, null, null);
    }

    public static ItemPayload agentMessage(String text) {
        return new ItemPayload(ItemKind.AGENT_MESSAGE, "agent_message", null, null,
                null, null, text, null, null);
    }

    /**
     * Decodes a payload node. Tolerates both the flat layout ({@code data.path}) and the
     * nested change list layout ({@code item.changes[0].path}).
     */
    public static ItemPayload from(JsonNode data) {
        if (data == null || !data.isObject()) {
            return new ItemPayload(ItemKind.OTHER, null, null, null, null, null, null, null, null);
        }
        String kindName = text(data, "type", "item_type", "kind");
        ItemKind kind = ItemKind.fromWireName(kindName);

        String path = text(data, "path", "file", "filePath");
        String operation = text(data, "operation", "change_type");
        JsonNode changes = data.get("changes");
        if (changes != null && changes.isArray() && !changes.isEmpty()) {
            JsonNode first = changes.get(0);
            if (path == null) {
                path = text(first, "path");
            }
            if (operation == null) {
                operation = text(first, "kind", "operation");
            }
        }
        if (operation == null && kind == ItemKind.FILE_CHANGE) {
            // "kind" doubles as the operation on flat file_change payloads
            operation = text(data, "kind");
        }

        String command = text(data, "command", "cmd");
        Integer exitCode = integer(data, "exit_code", "exitCode");
        String message = text(data, "text", "content", "message");
        String description = text(data, "description");

        return new ItemPayload(kind, kindName, path, operation, command, exitCode, message, description, data);
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                if (value.isArray()) {
                    // argv-style commands
                    StringBuilder joined = new StringBuilder();
                    value.forEach(part -> {
                        if (joined.length() > 0) {
                            joined.append(' ');
                        }
                        joined.append(part.asText());
                    });
                    return joined.toString();
                }
                if (value.isValueNode()) {
                    return value.asText();
                }
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.canConvertToInt()) {
                return value.asInt();
            }
        }
        return null;
    }
}
