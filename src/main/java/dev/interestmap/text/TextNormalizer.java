package dev.interestmap.text;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes learner free text the same way the classifier's training data was
 * normalized: lower-case, expand slang and abbreviations on word boundaries,
 * drop everything but letters, digits, whitespace and hyphens, collapse spaces.
 */
@Component
public class TextNormalizer {

    private static final Pattern DISALLOWED_CHARS =
            Pattern.compile("[^\\p{L}\\p{N}_\\s\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // Applied in declaration order; later entries see the output of earlier ones.
    private static final Map<String, String> ABBREVIATIONS = buildAbbreviations();

    private final Map<Pattern, String> expansions;

    public TextNormalizer() {
        Map<Pattern, String> compiled = new LinkedHashMap<>();
        ABBREVIATIONS.forEach((abbreviation, expansion) -> compiled.put(
                Pattern.compile("\\b" + Pattern.quote(abbreviation) + "\\b", Pattern.UNICODE_CHARACTER_CLASS),
                Matcher.quoteReplacement(expansion)));
        this.expansions = Collections.unmodifiableMap(compiled);
    }

    /**
     * @return the processed text, or an empty string for null/blank input
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String processed = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> expansion : expansions.entrySet()) {
            processed = expansion.getKey().matcher(processed).replaceAll(expansion.getValue());
        }
        processed = DISALLOWED_CHARS.matcher(processed).replaceAll(" ");
        return WHITESPACE.matcher(processed).replaceAll(" ").trim();
    }

    /**
     * Length of processed text in characters (code points).
     */
    public static int length(String processedText) {
        return processedText == null ? 0 : processedText.codePointCount(0, processedText.length());
    }

    public static Map<String, String> abbreviations() {
        return ABBREVIATIONS;
    }

    private static Map<String, String> buildAbbreviations() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("tb", "também");
        table.put("tbm", "também");
        table.put("tmb", "também");
        table.put("pq", "porque");
        table.put("pqp", "porque");
        table.put("pk", "porque");
        table.put("vc", "você");
        table.put("vcs", "vocês");
        table.put("cê", "você");
        table.put("mt", "muito");
        table.put("mto", "muito");
        table.put("mts", "muitos");
        table.put("q", "que");
        table.put("qq", "qualquer");
        table.put("qqr", "qualquer");
        table.put("n", "não");
        table.put("ñ", "não");
        table.put("nn", "não não");
        table.put("ta", "está");
        table.put("tá", "está");
        table.put("tão", "estão");
        table.put("to", "estou");
        table.put("tô", "estou");
        table.put("tou", "estou");

        // slang
        table.put("top", "ótimo");
        table.put("show", "ótimo");
        table.put("massa", "legal");
        table.put("daora", "legal");
        table.put("maneiro", "legal");
        table.put("irado", "legal");
        table.put("suave", "tranquilo");
        table.put("deboa", "tranquilo");
        table.put("blz", "beleza");
        table.put("fmz", "firmeza");

        // expressions
        table.put("tmj", "estamos juntos");
        table.put("vlw", "valeu");
        table.put("flw", "falou");
        table.put("pdp", "pode pá");
        table.put("pprt", "papo reto");
        table.put("plmdds", "pelo amor de deus");
        table.put("pdc", "pode crer");
        table.put("tlgd", "tá ligado");
        table.put("mec", "mano");
        table.put("mlk", "moleque");
        table.put("ctz", "certeza");
        table.put("ctza", "certeza");
        return Collections.unmodifiableMap(table);
    }
}
