package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.AgeGroup;
import com.poolintel.schedule.model.ClassificationResult;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.SwimType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a program is a drop-in swim and which kind.
 *
 * Swim detection is a keyword test over title + category. The swim type is the
 * pattern whose match spans the largest share of the title; confidence is
 * min(1, matchLength / titleLength * 2). Patterns that match inside the title
 * take precedence over matches found only in the category text.
 */
@Component
@Slf4j
public class ActivityClassifier {

    static final double DEFAULT_CONFIDENCE = 0.5;

    static final List<String> SWIM_KEYWORDS = List.of(
            "lane swim", "lane swimming", "lap swim", "lap swimming",
            "leisure swim", "recreational swim", "family swim",
            "adult swim", "senior swim", "aquafit", "aqua fit",
            "water fit", "aquacise", "aqua aerobics",
            "public swim", "open swim", "drop-in swim"
    );

    static final Map<SwimType, List<Pattern>> SWIM_TYPE_PATTERNS = buildPatterns();

    private static final Pattern YOUTH = Pattern.compile("\\b(child|children|kids?|youth)\\b");
    private static final Pattern ADULT = Pattern.compile("\\badults?\\b|\\b(19|18)\\+");
    private static final Pattern SENIOR = Pattern.compile("\\bseniors?\\b|\\b(55|60|65)\\+");
    private static final Pattern FAMILY = Pattern.compile("\\bfamil(y|ies)\\b");

    public ClassificationResult classify(RawCourseRecord record) {
        return classify(record.getTitle(), record.getCategory());
    }

    public ClassificationResult classify(String title, String category) {
        String safeTitle = title == null ? "" : title.trim();
        String text = (safeTitle + " " + (category == null ? "" : category)).toLowerCase(Locale.ROOT);

        if (!isSwimActivity(text)) {
            return ClassificationResult.notSwim();
        }

        int titleLength = Math.max(1, safeTitle.length());

        // Title first; category-only matches are consulted when the title says nothing specific
        TypeMatch best = bestMatch(safeTitle.toLowerCase(Locale.ROOT), titleLength);
        if (best != null) {
            best = new TypeMatch(best.type(), Math.max(DEFAULT_CONFIDENCE, best.confidence()));
        } else {
            best = bestMatch(text, titleLength);
        }
        if (best == null) {
            best = new TypeMatch(SwimType.LANE_SWIM, DEFAULT_CONFIDENCE);
        }

        return ClassificationResult.builder()
                .swim(true)
                .swimType(best.type())
                .confidence(best.confidence())
                .tags(detectTags(text))
                .ageGroup(detectAgeGroup(text))
                .build();
    }

    public boolean isSwimActivity(String lowerText) {
        return SWIM_KEYWORDS.stream().anyMatch(lowerText::contains);
    }

    /**
     * Highest-confidence pattern hit in {@code lowerText}, ties going to the earlier table entry.
     */
    TypeMatch bestMatch(String lowerText, int titleLength) {
        TypeMatch best = null;
        for (Map.Entry<SwimType, List<Pattern>> entry : SWIM_TYPE_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher m = pattern.matcher(lowerText);
                if (!m.find()) continue;
                double confidence = Math.min(1.0, (double) m.group().length() / titleLength * 2);
                if (best == null || confidence > best.confidence()) {
                    best = new TypeMatch(entry.getKey(), confidence);
                }
            }
        }
        return best;
    }

    Set<String> detectTags(String lowerText) {
        Set<String> tags = new TreeSet<>();
        if (lowerText.contains("adult")) tags.add("adults_only");
        if (lowerText.contains("senior")) tags.add("seniors");
        if (lowerText.contains("family")) tags.add("family_friendly");
        if (lowerText.contains("deep")) tags.add("deep_water");
        if (lowerText.contains("shallow")) tags.add("shallow_water");
        return Collections.unmodifiableSet(tags);
    }

    AgeGroup detectAgeGroup(String lowerText) {
        if (YOUTH.matcher(lowerText).find()) return AgeGroup.YOUTH;
        if (ADULT.matcher(lowerText).find()) return AgeGroup.ADULT;
        if (SENIOR.matcher(lowerText).find()) return AgeGroup.SENIOR;
        if (FAMILY.matcher(lowerText).find()) return AgeGroup.FAMILY;
        return null;
    }

    private static Map<SwimType, List<Pattern>> buildPatterns() {
        Map<SwimType, List<Pattern>> patterns = new LinkedHashMap<>();
        patterns.put(SwimType.LANE_SWIM, compile(
                "lane\\s+swim", "lap\\s+swim", "length\\s+swim", "adult\\s+lane", "senior\\s+lane"));
        patterns.put(SwimType.AQUAFIT, compile(
                "aqua\\s*fit", "water\\s+fit", "aqua\\s*cise", "aqua\\s+aerobics", "water\\s+aerobics"));
        patterns.put(SwimType.RECREATIONAL, compile(
                "leisure\\s+swim", "recreational\\s+swim", "family\\s+swim", "public\\s+swim", "open\\s+swim"));
        patterns.put(SwimType.ADULT_SWIM, compile("adult\\s+swim", "adults?\\s+only"));
        patterns.put(SwimType.SENIOR_SWIM, compile("senior\\s+swim", "seniors?\\s+only", "older\\s+adult"));
        return Collections.unmodifiableMap(patterns);
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }

    record TypeMatch(SwimType type, double confidence) {}
}
