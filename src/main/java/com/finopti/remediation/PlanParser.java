package com.finopti.remediation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a resolution plan, either as a JSON object or as free text.
 *
 * <p>JSON form: {@code {"infra_change", "commands", "validation_query",
 * "browser_test": {"url", "scenario"}}}. Free text is classified with keyword
 * heuristics; a URL found in the plan (or failing that, the RCA) becomes the
 * browser target.
 */
public class PlanParser {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s)\"'>\\]]+");

    private static final Pattern CLAUSE_SPLIT = Pattern.compile("[.,;:!?\\n]+");
    private static final Pattern NEGATION = Pattern.compile(
        "\\b(no|not|don't|dont|never|avoid|without|nothing|skip)\\b");

    private static final List<Pattern> INFRA_KEYWORDS = wordPatterns(
        "gcloud", "iam", "role", "roles", "permission", "permissions", "grant", "binding", "deploy", "redeploy",
        "rollback", "roll back", "restart", "scale", "update the service", "firewall",
        "quota", "configure", "config change", "set-iam-policy", "kubectl", "terraform",
        "env var", "environment variable", "apply"
    );

    private static final List<String> NO_INFRA_PHRASES = List.of(
        "no infrastructure change", "no infra change", "no infrastructure changes",
        "no infra changes", "without infrastructure change", "code change only",
        "no changes required", "no change required", "no action", "nothing to change", "monitor only"
    );

    private static final List<Pattern> BROWSER_KEYWORDS = wordPatterns(
        "browser", "puppeteer", "ui test", "end-to-end", "end to end", "e2e",
        "user-facing", "user facing", "verify the page", "screenshot", "navigate to"
    );

    private static final List<String> NO_BROWSER_PHRASES = List.of(
        "no browser test", "no ui test", "no end-to-end", "skip browser", "without browser"
    );

    private final ObjectMapper mapper;

    public PlanParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws InvalidPlanException the RCA or plan is blank, or the plan looks
     *         like JSON but does not parse as a JSON object
     */
    public RemediationPlan parse(String rcaDocument, String resolutionPlan) throws InvalidPlanException {
        if (rcaDocument == null || rcaDocument.isBlank()) {
            throw new InvalidPlanException("rca_document is required");
        }
        if (resolutionPlan == null || resolutionPlan.isBlank()) {
            throw new InvalidPlanException("resolution_plan is required");
        }

        String plan = resolutionPlan.trim();
        if (plan.startsWith("{")) {
            return parseStructured(plan, rcaDocument);
        }
        return parseText(plan, rcaDocument);
    }

    private RemediationPlan parseStructured(String plan, String rcaDocument) throws InvalidPlanException {
        JsonNode root;
        try {
            root = mapper.readTree(plan);
        } catch (JsonProcessingException e) {
            throw new InvalidPlanException("resolution_plan is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidPlanException("resolution_plan JSON must be an object");
        }

        String instruction = commandsText(root.path("commands"));
        if (instruction == null) {
            instruction = textOrNull(root.get("instruction"));
        }
        boolean infraChange = root.has("infra_change")
            ? root.path("infra_change").asBoolean(false)
            : instruction != null;
        if (infraChange && instruction == null) {
            throw new InvalidPlanException("resolution_plan requests an infra change but names no commands");
        }

        JsonNode browser = root.get("browser_test");
        boolean browserTest = false;
        String browserUrl = null;
        String scenario = null;
        if (browser != null && browser.isObject()) {
            browserTest = browser.path("enabled").asBoolean(true);
            browserUrl = textOrNull(browser.get("url"));
            scenario = textOrNull(browser.get("scenario"));
        } else if (browser != null && browser.isBoolean()) {
            browserTest = browser.asBoolean();
        }
        if (browserTest && browserUrl == null) {
            browserUrl = findUrl(rcaDocument);
        }

        return new RemediationPlan(infraChange, instruction, textOrNull(root.get("validation_query")),
            browserTest, browserUrl, scenario);
    }

    private RemediationPlan parseText(String plan, String rcaDocument) {
        String lower = plan.toLowerCase(Locale.ROOT);

        boolean infraChange = !containsAny(lower, NO_INFRA_PHRASES) && mentions(lower, INFRA_KEYWORDS);
        boolean browserTest = !containsAny(lower, NO_BROWSER_PHRASES) && mentions(lower, BROWSER_KEYWORDS);

        String browserUrl = null;
        if (browserTest) {
            browserUrl = findUrl(plan);
            if (browserUrl == null) {
                browserUrl = findUrl(rcaDocument);
            }
        }
        return new RemediationPlan(infraChange, infraChange ? plan : null, null, browserTest, browserUrl, null);
    }

    static String findUrl(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = URL_PATTERN.matcher(text);
        if (!m.find()) {
            return null;
        }
        String url = m.group();
        while (url.endsWith(".") || url.endsWith(",") || url.endsWith(";")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    /**
     * True when some clause names a keyword as a whole word with no negation
     * ahead of it in that clause ("do not restart" does not count).
     */
    static boolean mentions(String lowerText, List<Pattern> keywords) {
        for (String clause : CLAUSE_SPLIT.split(lowerText)) {
            for (Pattern keyword : keywords) {
                Matcher m = keyword.matcher(clause);
                if (m.find() && !NEGATION.matcher(clause.substring(0, m.start())).find()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Pattern> wordPatterns(String... words) {
        List<Pattern> patterns = new ArrayList<>();
        for (String word : words) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(word) + "\\b"));
        }
        return List.copyOf(patterns);
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String commandsText(JsonNode commands) {
        if (commands == null || commands.isMissingNode() || commands.isNull()) {
            return null;
        }
        if (commands.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode c : commands) {
                String text = c.asText("").trim();
                if (text.isEmpty()) {
                    continue;
                }
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(text);
            }
            return sb.length() > 0 ? sb.toString() : null;
        }
        return textOrNull(commands);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String text = node.asText("").trim();
        return text.isEmpty() ? null : text;
    }
}
