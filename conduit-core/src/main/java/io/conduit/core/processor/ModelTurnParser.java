package io.conduit.core.processor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Splits raw model output into its tagged parts.
///
/// Recognized tags: `<thought>`, `<plan>`, `<tool_call>` (repeatable) and
/// `<response>`. Tags are matched case-insensitively and may span lines. An
/// unclosed `<response>` takes the rest of the output, since models sometimes
/// stop before the closing tag.
final class ModelTurnParser {

    private static final Pattern THOUGHT = tag("thought");
    private static final Pattern PLAN = tag("plan");
    private static final Pattern TOOL_CALL = tag("tool_call");
    private static final Pattern RESPONSE = tag("response");
    private static final Pattern OPEN_RESPONSE =
            Pattern.compile("<response>(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ANY_KNOWN_TAG =
            Pattern.compile(
                    "</?(thought|plan|tool_call|response|observation|question)>",
                    Pattern.CASE_INSENSITIVE);

    private final ToolCallParser toolCallParser;

    ModelTurnParser(ToolCallParser toolCallParser) {
        this.toolCallParser = Objects.requireNonNull(toolCallParser, "toolCallParser");
    }

    ModelTurn parse(String output) {
        String text = output != null ? output : "";

        List<ToolCallRequest> toolCalls = new ArrayList<>();
        Matcher calls = TOOL_CALL.matcher(text);
        while (calls.find()) {
            toolCalls.add(toolCallParser.parse(calls.group(1).trim()));
        }

        String response = first(RESPONSE, text);
        if (response == null) {
            response = first(OPEN_RESPONSE, text);
        }

        return new ModelTurn(
                first(THOUGHT, text), first(PLAN, text), toolCalls, response, untagged(text));
    }

    private static String untagged(String text) {
        String stripped = THOUGHT.matcher(text).replaceAll("");
        stripped = PLAN.matcher(stripped).replaceAll("");
        stripped = TOOL_CALL.matcher(stripped).replaceAll("");
        stripped = RESPONSE.matcher(stripped).replaceAll("");
        return ANY_KNOWN_TAG.matcher(stripped).replaceAll("").trim();
    }

    private static String first(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    private static Pattern tag(String name) {
        return Pattern.compile(
                "<" + name + ">(.*?)</" + name + ">", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
