package com.finopti.dispatch;

import com.finopti.models.AgentDescriptor;
import com.finopti.registry.AgentRegistry;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks a target agent for a free-text task by scoring the task against each
 * agent's declared capabilities. Short tags (three characters or fewer) must
 * match a whole word; longer tags match as substrings. Ties go to the agent
 * listed first in the catalog.
 */
public class IntentResolver {

    private final AgentRegistry registry;
    private final String defaultAgentId;

    public IntentResolver(AgentRegistry registry, String defaultAgentId) {
        this.registry = registry;
        this.defaultAgentId = defaultAgentId;
    }

    /**
     * @return the best matching agent id, the default agent when nothing
     *         matches, or null when neither is in the registry
     */
    public String resolve(String task) {
        if (task == null || task.isBlank()) {
            return null;
        }
        String text = task.toLowerCase(Locale.ROOT);
        Set<String> words = new HashSet<>(Arrays.asList(text.split("[^a-z0-9_\\-]+")));

        List<AgentDescriptor> agents = registry.listAgents();
        String best = null;
        int bestScore = 0;
        for (AgentDescriptor agent : agents) {
            int score = score(agent, text, words);
            if (score > bestScore) {
                best = agent.getAgentId();
                bestScore = score;
            }
        }
        if (best != null) {
            return best;
        }
        if (defaultAgentId != null && registry.resolve(defaultAgentId) != null) {
            return defaultAgentId;
        }
        return null;
    }

    static int score(AgentDescriptor agent, String text, Set<String> words) {
        int score = 0;
        for (String capability : agent.getCapabilities()) {
            if (capability.length() <= 3) {
                if (words.contains(capability)) {
                    score++;
                }
            } else if (text.contains(capability)) {
                score++;
            }
        }
        return score;
    }
}
