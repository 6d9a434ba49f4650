package com.skilldeck.skills;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static com.skilldeck.skills.SkillException.ErrorKind.VALIDATION_FAILED;

/**
 * A parsed SKILL.md file: YAML frontmatter between {@code ---} lines, then the markdown body.
 *
 * <pre>
 * ---
 * name: Meeting Prep
 * description: Prepares a briefing before meetings
 * triggers:
 *   - meeting
 * tools:
 *   - calendar
 * priority: 5
 * maxTurns: 8
 * ---
 *
 * # Meeting Prep
 * ...
 * </pre>
 */
public record SkillDocument(
    String name,
    String description,
    List<String> triggers,
    List<String> tools,
    int priority,
    int maxTurns,
    String body
) {
    public static final String FILE_NAME = "SKILL.md";

    private static final Pattern INVALID_SLUG_CHARS = Pattern.compile("[^a-z0-9-]");

    public SkillDocument {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        tools = tools == null ? List.of() : List.copyOf(tools);
        body = body == null ? "" : body;
    }

    /**
     * Parses SKILL.md content. Throws {@link SkillException} with {@code VALIDATION_FAILED} when the
     * frontmatter is missing or is not a YAML mapping; field presence is checked by {@link #validate()}.
     */
    @SuppressWarnings("unchecked")
    public static SkillDocument parse(String content) {
        if (content == null || !content.startsWith("---")) {
            throw new SkillException(VALIDATION_FAILED, "SKILL.md must start with --- (YAML frontmatter)");
        }
        var rest = skipLineBreak(stripLeadingBlanks(content.substring(3)));
        // also matches "\r\n---"; the stray \r is a line break to the YAML parser
        int close = rest.indexOf("\n---");
        if (close == -1) {
            throw new SkillException(VALIDATION_FAILED, "SKILL.md missing closing --- for frontmatter");
        }
        var frontmatter = rest.substring(0, close);
        var body = rest.substring(close + 4);

        Object loaded;
        try {
            loaded = new Yaml().load(frontmatter);
        } catch (YAMLException e) {
            throw new SkillException(VALIDATION_FAILED, "failed to parse frontmatter: " + e.getMessage(), e);
        }
        if (loaded != null && !(loaded instanceof Map)) {
            throw new SkillException(VALIDATION_FAILED, "frontmatter must be a YAML mapping");
        }
        var raw = loaded == null ? Map.<String, Object>of() : (Map<String, Object>) loaded;
        return new SkillDocument(
            stringValue(raw.get("name")),
            stringValue(raw.get("description")),
            stringList(raw.get("triggers")),
            stringList(raw.get("tools")),
            intValue(raw.get("priority"), "priority"),
            intValue(raw.get("maxTurns"), "maxTurns"),
            body.strip()
        );
    }

    /** Requires a name, a description and a name that yields a slug. */
    public SkillDocument validate() {
        if (name == null || name.isBlank()) {
            throw new SkillException(VALIDATION_FAILED, "skill name is required");
        }
        if (description == null || description.isBlank()) {
            throw new SkillException(VALIDATION_FAILED, "skill \"" + name + "\": description is required");
        }
        if (slugify(name).isEmpty()) {
            throw new SkillException(VALIDATION_FAILED, "could not derive a valid slug from the skill name \"" + name + "\"");
        }
        if (maxTurns < 0) {
            throw new SkillException(VALIDATION_FAILED, "skill \"" + name + "\": maxTurns must not be negative");
        }
        return this;
    }

    public String slug() {
        return slugify(name);
    }

    public SkillDefinition toDefinition() {
        return new SkillDefinition(slug(), name, description, body, null, triggers, tools, priority, maxTurns);
    }

    /** Lower-cases, turns spaces and underscores into hyphens and drops anything not URL-safe. */
    public static String slugify(String name) {
        if (name == null) return "";
        var s = name.strip().toLowerCase(Locale.ROOT).replace(' ', '-').replace('_', '-');
        s = INVALID_SLUG_CHARS.matcher(s).replaceAll("");
        while (s.contains("--")) s = s.replace("--", "-");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }

    private static String stripLeadingBlanks(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) i++;
        return s.substring(i);
    }

    private static String skipLineBreak(String s) {
        if (s.startsWith("\r\n")) return s.substring(2);
        if (s.startsWith("\n")) return s.substring(1);
        return s;
    }

    private static String stringValue(Object v) {
        return v == null ? null : String.valueOf(v).strip();
    }

    private static List<String> stringList(Object v) {
        if (v == null) return List.of();
        if (v instanceof List<?> list) {
            return list.stream().filter(o -> o != null).map(String::valueOf).toList();
        }
        return List.of(String.valueOf(v));
    }

    private static int intValue(Object v, String field) {
        if (v == null) return 0;
        try {
            return Integer.parseInt(String.valueOf(v).strip());
        } catch (NumberFormatException e) {
            throw new SkillException(VALIDATION_FAILED, field + " must be an integer, got \"" + v + "\"");
        }
    }
}
