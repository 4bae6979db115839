package com.eainde.verify.extract;

import com.eainde.verify.error.ExtractionFailureException;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, template-driven claim extractor for markdown-like artifacts.
 *
 * <h3>Templates (selected by the domain's {@code extractionTemplateRef}):</h3>
 * <ul>
 *   <li><b>declarative-sentences</b>: a sentence is a claim when it carries a number, or a
 *   declarative verb together with a specific technical term.</li>
 *   <li><b>bullet-items</b>: every list item is a claim.</li>
 * </ul>
 * Headings ({@code #} to {@code ###}) delimit sections; fenced code blocks are skipped.
 */
public class HeuristicClaimExtractor implements ClaimExtractor {

    private static final Logger log = LoggerFactory.getLogger(HeuristicClaimExtractor.class);

    public static final String DECLARATIVE_SENTENCES = "declarative-sentences";
    public static final String BULLET_ITEMS = "bullet-items";

    private static final String NO_SECTION = "Document";

    private static final Pattern HEADING = Pattern.compile("^#{1,3}\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(.+)$");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern DECLARATIVE = Pattern.compile(
            "\\b(is|are|will|must|shall|provides?|supports?|includes?|requires?|limits?|allows?|ensures?"
                    + "|stores?|encrypts?|processes?|retains?|returns?|rejects?|validates?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SPECIFIC = Pattern.compile(
            "\\b(GB|MB|TB|ms|seconds?|minutes?|hours?|days?|%|per|AES|SHA|RSA|SSL|TLS|HTTPS|OAuth|JWT|REST|GraphQL"
                    + "|API|endpoint|token|password|encrypt\\w*|database|request|response)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CRITICAL = Pattern.compile(
            "\\b(encrypt\\w*|password|credential|secret|breach|data loss|delete[sd]?|AES|TLS|SSL|authenticat\\w*)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HIGH = Pattern.compile("\\b(must|shall|always|never|guarantee[sd]?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LOW = Pattern.compile("\\b(may|can|optionally|typically)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public List<Claim> extract(Artifact artifact, DomainContext context) {
        String template = context.extractionTemplateRef() == null
                ? DECLARATIVE_SENTENCES : context.extractionTemplateRef();

        List<Section> sections = splitSections(artifact.content());
        List<Claim> claims = new ArrayList<>();
        // Occurrences per (section title, statement) across the artifact; headings may repeat.
        Map<String, Integer> occurrences = new HashMap<>();
        for (Section section : sections) {
            List<String> statements = switch (template) {
                case DECLARATIVE_SENTENCES -> declarativeSentences(section);
                case BULLET_ITEMS -> bulletItems(section);
                default -> throw new ExtractionFailureException(context.domainId(),
                        "Unknown extraction template '%s' for domain '%s'".formatted(template, context.domainId()));
            };
            claims.addAll(toClaims(statements, section.title(), context, occurrences));
        }

        if (claims.isEmpty()) {
            throw new ExtractionFailureException(context.domainId(),
                    "No claims derivable from artifact '%s' v%d using template '%s'"
                            .formatted(artifact.artifactId(), artifact.version(), template));
        }
        log.debug("Extracted {} claim(s) from {} section(s) of artifact {} v{} for domain {}",
                claims.size(), sections.size(), artifact.artifactId(), artifact.version(), context.domainId());
        return List.copyOf(claims);
    }

    // =========================================================================
    //  Templates
    // =========================================================================

    private List<String> declarativeSentences(Section section) {
        List<String> out = new ArrayList<>();
        for (String segment : segments(section.lines())) {
            for (String sentence : SENTENCE_SPLIT.split(segment)) {
                String s = sentence.strip();
                if (s.isEmpty()) {
                    continue;
                }
                boolean hasNumber = NUMBER.matcher(s).find();
                boolean hasDeclarative = DECLARATIVE.matcher(s).find();
                boolean hasSpecific = SPECIFIC.matcher(s).find();
                if (hasNumber || (hasDeclarative && hasSpecific)) {
                    out.add(s);
                }
            }
        }
        return out;
    }

    /**
     * Consecutive prose lines form one segment; every list item is a segment of its own.
     */
    private static List<String> segments(List<String> lines) {
        List<String> segments = new ArrayList<>();
        StringBuilder prose = new StringBuilder();
        for (String line : lines) {
            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                flush(prose, segments);
                segments.add(bullet.group(1).strip());
            } else {
                if (prose.length() > 0) {
                    prose.append(' ');
                }
                prose.append(line.strip());
            }
        }
        flush(prose, segments);
        return segments;
    }

    private static void flush(StringBuilder prose, List<String> segments) {
        if (prose.length() > 0) {
            segments.add(prose.toString());
            prose.setLength(0);
        }
    }

    private List<String> bulletItems(Section section) {
        List<String> out = new ArrayList<>();
        for (String line : section.lines()) {
            Matcher m = BULLET.matcher(line);
            if (m.matches() && !m.group(1).isBlank()) {
                out.add(m.group(1).strip());
            }
        }
        return out;
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private List<Claim> toClaims(List<String> statements, String section, DomainContext context,
                                 Map<String, Integer> occurrences) {
        List<Claim> claims = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i);
            int occurrence = occurrences.merge(section + '\n' + ClaimIds.normalize(statement), 1, Integer::sum) - 1;
            String id = ClaimIds.derive(context.domainId(), section, statement, occurrence);
            claims.add(new Claim(
                    id,
                    context.domainId(),
                    statement,
                    section + "#" + (i + 1),
                    context.iteration(),
                    section,
                    inferSeverity(statement)));
        }
        return claims;
    }

    static ClaimSeverity inferSeverity(String statement) {
        if (CRITICAL.matcher(statement).find()) {
            return ClaimSeverity.CRITICAL;
        }
        if (HIGH.matcher(statement).find()) {
            return ClaimSeverity.HIGH;
        }
        if (LOW.matcher(statement).find()) {
            return ClaimSeverity.LOW;
        }
        return ClaimSeverity.MEDIUM;
    }

    private static List<Section> splitSections(String content) {
        List<Section> sections = new ArrayList<>();
        String title = NO_SECTION;
        List<String> lines = new ArrayList<>();
        boolean inFence = false;

        for (String line : content.split("\\R")) {
            if (line.strip().startsWith("```")) {
                inFence = !inFence;
                continue;
            }
            if (inFence) {
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                if (!lines.isEmpty()) {
                    sections.add(new Section(title, lines));
                }
                title = heading.group(1).strip();
                lines = new ArrayList<>();
            } else if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (!lines.isEmpty()) {
            sections.add(new Section(title, lines));
        }
        return sections;
    }

    private record Section(String title, List<String> lines) {
    }
}
