package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.DetectedSignals;
import com.psyos.pipeline.domain.PatientLanguage;
import com.psyos.pipeline.domain.SignalConfig;
import com.psyos.pipeline.domain.SignalKey;
import com.psyos.pipeline.domain.SignalOverrides;
import com.psyos.pipeline.domain.SignalRule;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword classifier over a single patient message.
 *
 * Text and keywords are compared after lower-casing and stripping diacritics, so
 * "Não sei" matches the keyword "nao sei". A signal fires when any of its keywords
 * is a substring of the normalized text.
 */
@Component
public class SignalDetector {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    static final Map<SignalKey, List<String>> DEFAULT_KEYWORDS = new EnumMap<>(SignalKey.class);

    static {
        DEFAULT_KEYWORDS.put(SignalKey.ANGER, List.of(
                "enfadada", "me dijo", "salte", "saltei", "conteste", "contestei", "otra vez igual"));
        DEFAULT_KEYWORDS.put(SignalKey.DISCONNECT, List.of(
                "nada", "no se", "no sei", "vacio", "vazio", "agotada"));
        DEFAULT_KEYWORDS.put(SignalKey.RUMINATION, List.of(
                "por que sou assim", "por que soy asi", "nao paro de pensar"));
        DEFAULT_KEYWORDS.put(SignalKey.HIGH_RISK, List.of(
                "suicid", "me matar", "morrer", "sem vontade de viver", "autoagress", "overdose",
                "morir", "matarme", "quitarme la vida", "no quiero vivir", "autolesion"));
    }

    // Directives without a known patient language are the Portuguese clinical defaults
    private static final PatientLanguage DEFAULT_DIRECTIVE_LANGUAGE = PatientLanguage.PT;

    public DetectedSignals detect(String text, SignalConfig config) {
        SignalConfig resolved = config != null ? config : defaults(DEFAULT_DIRECTIVE_LANGUAGE);
        String normalized = normalize(text);
        return new DetectedSignals(
                fires(normalized, resolved.keywords(SignalKey.ANGER)),
                fires(normalized, resolved.keywords(SignalKey.DISCONNECT)),
                fires(normalized, resolved.keywords(SignalKey.RUMINATION)),
                fires(normalized, resolved.keywords(SignalKey.HIGH_RISK)));
    }

    public SignalConfig resolveConfig(SignalOverrides overrides) {
        return resolveConfig(overrides, DEFAULT_DIRECTIVE_LANGUAGE);
    }

    /**
     * Merges overrides over the defaults key by key. Non-empty keywords replace the
     * default keywords and a non-blank directive replaces the default directive;
     * anything else keeps the default for that key.
     */
    public SignalConfig resolveConfig(SignalOverrides overrides, PatientLanguage language) {
        ReplyCopy copy = ReplyCopy.forLanguage(language);
        Map<SignalKey, SignalConfig.Rule> rules = new EnumMap<>(SignalKey.class);
        for (SignalKey key : SignalKey.values()) {
            SignalRule override = overrides != null ? overrides.get(key) : null;
            List<String> keywords = override != null && override.hasKeywords()
                    ? override.getKeywords()
                    : DEFAULT_KEYWORDS.get(key);
            String directive = override != null && override.hasDirective()
                    ? override.getDirective()
                    : copy.signalDirective(key);
            rules.put(key, new SignalConfig.Rule(keywords, directive));
        }
        return new SignalConfig(rules);
    }

    public SignalConfig defaults(PatientLanguage language) {
        return resolveConfig(null, language);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private static boolean fires(String normalizedText, List<String> keywords) {
        for (String keyword : keywords) {
            String normalizedKeyword = normalize(keyword);
            if (!normalizedKeyword.isEmpty() && normalizedText.contains(normalizedKeyword)) {
                return true;
            }
        }
        return false;
    }
}
