package com.sagarmitra.service.impl;

import com.sagarmitra.language.SupportedLanguage;
import com.sagarmitra.tools.AgentTool;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Component
public class SystemPromptBuilder {

    private static final String PERSONA = """
            You are **SagarMitra** (सागरमित्र), an AI-powered companion for Indian fishermen.

            You are friendly, practical, and deeply knowledgeable about:
            • Fishing techniques, species, seasons, and regulations in Indian coastal waters
            • Sea safety, weather patterns, and monsoon cycles
            • Government schemes for fishermen (PM Matsya Sampada Yojana, fishing bans, subsidies)
            • Basic boat maintenance and equipment care
            • Market prices, fish preservation, and supply chain tips

            **Personality**: Warm, respectful, uses simple language. Address the user like an older brother or \
            fellow fisherman would. Use encouragement and practical wisdom.
            """;

    public String build(String languageCode,
                        @Nullable String summary,
                        @Nullable String durableFacts,
                        List<AgentTool> tools) {
        String label = SupportedLanguage.labelFor(languageCode);
        List<String> sections = new ArrayList<>();
        sections.add(PERSONA);
        sections.add(languageRules(label, languageCode));

        if (StringUtils.hasText(summary)) {
            sections.add("## Earlier Conversation Summary\n" + summary + "\n");
        }
        if (StringUtils.hasText(durableFacts)) {
            sections.add("## About This User (Long-Term Memory)\n" + durableFacts + "\n");
        }
        sections.add(toolsSection(tools));
        return String.join("\n", sections);
    }

    private String languageRules(String label, String code) {
        return "**Language rules**:\n"
                + "- CRITICAL: You MUST ALWAYS respond entirely and exclusively in **" + label + " (" + code + ")**.\n"
                + "- If a user asks a question in English but the selected language is " + label
                + ", you MUST reply in " + label + ".\n"
                + "- DO NOT output English unless specifically asked to translate or if there is no equivalent technical word.\n"
                + "- If the user writes in romanised/transliterated " + label
                + ", that is perfectly fine; respond using proper " + label + " script.\n"
                + "- Keep sentences short and clear; many users may have limited literacy.\n"
                + "- Translate any tool outputs, market prices, and fish names into **" + label
                + "** before showing them to the user.\n";
    }

    private String toolsSection(List<AgentTool> tools) {
        StringBuilder section = new StringBuilder("## Tools\n");
        if (tools.isEmpty()) {
            section.append("No tools are available in this session. Answer from your own knowledge.\n");
            return section.toString();
        }
        section.append("You have access to the following tools. Use them proactively when the user's question relates to them:\n");
        for (AgentTool tool : tools) {
            section.append("• **").append(tool.name()).append("**: ").append(tool.description()).append('\n');
        }
        section.append("\nWhen calling a tool, wait for the result before responding. "
                + "Incorporate the result naturally into your reply.\n");
        return section.toString();
    }
}
