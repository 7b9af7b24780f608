package com.videopipe.orchestrator.service.script;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 마크다운 스크립트 파서
 *
 * 형식:
 * <pre>
 * # 제목
 * **Location**: Seoul
 * ---                       (씬 구분선: ---, ***, ___)
 * 나레이션 문장
 * "대사" - 화자
 * [연출 지시]
 * </pre>
 */
@Slf4j
@Component
public class ScriptParser {

    private static final Pattern METADATA_PATTERN = Pattern.compile("^\\*\\*(.+?)\\*\\*:\\s*(.+)$");
    private static final Pattern SCENE_BREAK_PATTERN = Pattern.compile("^(?:-{3,}|\\*{3,}|_{3,})\\s*$");
    private static final Pattern DIALOGUE_PATTERN = Pattern.compile("^\"(.+?)\"(?:\\s*[-—]\\s*(.+))?$");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    // 읽기 속도 (분당 단어 수)
    private static final int WORDS_PER_MINUTE_NARRATION = 150;
    private static final int WORDS_PER_MINUTE_DIALOGUE = 180;
    private static final double DIRECTION_SECONDS = 2.0;
    private static final int MAX_FALLBACK_PROMPT_LENGTH = 200;

    private static final List<Pattern> DESCRIPTIVE_PATTERNS = List.of(
            Pattern.compile("(?:people|figures?|crowds?)\\s+(?:on|in|at)\\s+(?:the\\s+)?\\w+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:wearing|dressed in|wore)\\s+\\w+(?:\\s+\\w+)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:facility|building|room|street|city|forest)\\s+(?:with\\s+)?\\w+(?:\\s+\\w+)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:screens?|monitors?|displays?)\\s+(?:showing|displaying)\\s+\\w+(?:\\s+\\w+)?", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> ATMOSPHERE_KEYWORDS = List.of(
            "dark", "bright", "gloomy", "empty", "crowded", "abandoned",
            "burning", "frozen", "silent", "chaotic", "misty", "sunlit");

    private static final Map<String, List<String>> TONE_KEYWORDS = new LinkedHashMap<>();

    static {
        TONE_KEYWORDS.put("fear", List.of("terror", "afraid", "scared", "horror", "nightmare"));
        TONE_KEYWORDS.put("urgency", List.of("hurry", "must", "now", "immediately"));
        TONE_KEYWORDS.put("hopeless", List.of("can't", "impossible", "failed", "futile"));
        TONE_KEYWORDS.put("joy", List.of("laugh", "smile", "celebrate", "happy"));
        TONE_KEYWORDS.put("calm", List.of("quiet", "gentle", "peaceful", "still"));
    }

    /**
     * 스크립트를 씬 단위로 분해. 본문이 없는 구간은 씬으로 만들지 않는다.
     */
    public ParsedScript parse(String content) {
        String title = "";
        Map<String, String> metadata = new LinkedHashMap<>();
        List<ParsedScript.Scene> scenes = new ArrayList<>();

        List<String> current = new ArrayList<>();
        int currentStart = 0;
        boolean inMetadata = false;

        String[] lines = content == null ? new String[0] : content.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("# ")) {
                title = line.substring(2).strip();
                continue;
            }

            Matcher metadataMatcher = METADATA_PATTERN.matcher(line);
            if (metadataMatcher.matches()) {
                metadata.put(metadataMatcher.group(1).strip().toLowerCase(Locale.ROOT), metadataMatcher.group(2).strip());
                inMetadata = true;
                continue;
            }

            if (SCENE_BREAK_PATTERN.matcher(line).matches()) {
                if (!current.isEmpty()) {
                    scenes.add(new ParsedScript.Scene(scenes.size(), currentStart, String.join("\n", current)));
                    current = new ArrayList<>();
                }
                inMetadata = false;
                continue;
            }

            // 메타데이터 블록 아래의 "- key: value" 항목
            if (inMetadata && line.startsWith("- ") && line.contains(":")) {
                String[] keyValue = line.substring(2).split(":", 2);
                metadata.put(keyValue[0].strip().toLowerCase(Locale.ROOT), keyValue[1].strip());
                continue;
            }

            if (current.isEmpty()) {
                currentStart = i + 1;
            }
            current.add(line);
        }
        if (!current.isEmpty()) {
            scenes.add(new ParsedScript.Scene(scenes.size(), currentStart, String.join("\n", current)));
        }

        log.debug("[ScriptParser] Parsed '{}' into {} scenes", title, scenes.size());
        return new ParsedScript(title, metadata, scenes);
    }

    /**
     * 씬 본문을 나레이션/대사/연출 지시로 나누고 시각 프롬프트와 길이를 추정
     */
    public SceneAnalysis analyze(String sceneText) {
        List<String> spoken = new ArrayList<>();
        List<String> narrative = new ArrayList<>();
        List<String> directions = new ArrayList<>();
        Set<String> speakers = new LinkedHashSet<>();
        Set<String> visualCues = new LinkedHashSet<>();
        double seconds = 0;

        for (String raw : sceneText == null ? new String[0] : sceneText.split("\\r?\\n")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }

            Matcher dialogue = DIALOGUE_PATTERN.matcher(line);
            if (dialogue.matches()) {
                spoken.add(dialogue.group(1).strip());
                if (dialogue.group(2) != null) {
                    speakers.add(dialogue.group(2).strip());
                }
                seconds += timing(dialogue.group(1), WORDS_PER_MINUTE_DIALOGUE);
                continue;
            }

            if (line.startsWith("[") && line.endsWith("]") && line.length() > 2) {
                directions.add(line.substring(1, line.length() - 1).strip());
                seconds += DIRECTION_SECONDS;
                continue;
            }

            narrative.add(line);
            spoken.add(line);
            visualCues.addAll(extractVisualCues(line));
            seconds += timing(line, WORDS_PER_MINUTE_NARRATION);
        }

        return SceneAnalysis.builder()
                .narration(String.join(" ", spoken))
                .visualPrompt(buildVisualPrompt(directions, visualCues, narrative))
                .durationSeconds(Math.max(1, (int) Math.ceil(seconds)))
                .emotionalTone(detectTone(String.join(" ", narrative)))
                .speakers(List.copyOf(speakers))
                .directions(List.copyOf(directions))
                .visualCues(List.copyOf(visualCues))
                .build();
    }

    List<String> extractVisualCues(String text) {
        List<String> cues = new ArrayList<>();
        for (Pattern pattern : DESCRIPTIVE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                cues.add(matcher.group());
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : ATMOSPHERE_KEYWORDS) {
            if (Pattern.compile("\\b" + keyword + "\\b").matcher(lower).find()) {
                cues.add("atmosphere: " + keyword);
            }
        }
        return cues;
    }

    private String buildVisualPrompt(List<String> directions, Set<String> cues, List<String> narrative) {
        List<String> parts = new ArrayList<>(directions);
        parts.addAll(cues);
        if (parts.isEmpty() && !narrative.isEmpty()) {
            String firstSentence = SENTENCE_END.split(narrative.get(0), 2)[0];
            parts.add(firstSentence.length() > MAX_FALLBACK_PROMPT_LENGTH
                    ? firstSentence.substring(0, MAX_FALLBACK_PROMPT_LENGTH)
                    : firstSentence);
        }
        return String.join(", ", parts);
    }

    private String detectTone(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> tones = new ArrayList<>();
        TONE_KEYWORDS.forEach((tone, keywords) -> {
            if (keywords.stream().anyMatch(lower::contains)) {
                tones.add(tone);
            }
        });
        return tones.isEmpty() ? "neutral" : String.join(", ", tones);
    }

    private double timing(String text, int wordsPerMinute) {
        int words = text.strip().isEmpty() ? 0 : text.strip().split("\\s+").length;
        return words * 60.0 / wordsPerMinute;
    }
}
