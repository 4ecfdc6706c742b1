package com.purchasingpower.recall.support;

import com.purchasingpower.recall.client.LLMProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM that answers with a canned response and records the prompts it saw.
 */
public class StubLlmProvider implements LLMProvider {

    private final List<String> prompts = new ArrayList<>();
    private volatile String response;

    public StubLlmProvider(String response) {
        this.response = response;
    }

    public void respondWith(String response) {
        this.response = response;
    }

    @Override
    public String chat(String prompt, String purpose, String conversationId) {
        prompts.add(prompt);
        return response;
    }

    @Override
    public String getProviderName() {
        return "Stub";
    }

    public List<String> prompts() {
        return prompts;
    }
}
