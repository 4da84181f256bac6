package com.ryuqq.agentsession.application.routing;

import com.ryuqq.agentsession.core.runner.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 라벨과 설명 태그로 백엔드/모델을 결정.
 *
 * <p><strong>우선순위:</strong></p>
 * <ol>
 *   <li>설명의 {@code [agent=...]} 태그</li>
 *   <li>에이전트 라벨 ({@code cursor}, {@code codex}/{@code openai}, {@code gemini}, {@code claude}/{@code opus})</li>
 *   <li>명시 모델({@code [model=...]} 태그 또는 모델 라벨)로부터 추론</li>
 *   <li>설정의 기본 백엔드</li>
 * </ol>
 *
 * <p>명시 모델이 결정된 백엔드와 맞지 않으면 버리고 백엔드 기본 모델을 사용합니다.
 * 대체 모델은 선택된 모델로부터 추론합니다.</p>
 *
 * <pre>
 * select(List.of("gemini-2.5-flash"), null)
 * // → RunnerSelection[backend=GEMINI, model=gemini-2.5-flash, fallbackModel=gemini-2.5-flash-lite]
 *
 * select(List.of("codex"), "Please fix [model=opus]")
 * // → RunnerSelection[backend=CODEX, model=gpt-5.3-codex, fallbackModel=gpt-5.3]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunnerSelectionService {

    private static final Logger log = LoggerFactory.getLogger(RunnerSelectionService.class);

    private static final Pattern CODEX_MODEL_SUFFIX = Pattern.compile("gpt-[a-z0-9.-]*codex$", Pattern.CASE_INSENSITIVE);
    private static final Pattern GPT_MODEL = Pattern.compile("^gpt-[a-z0-9.-]+$", Pattern.CASE_INSENSITIVE);

    private static final Map<BackendType, String> DEFAULT_MODELS = new EnumMap<>(Map.of(
        BackendType.CLAUDE, "opus",
        BackendType.GEMINI, "gemini-2.5-pro",
        BackendType.CURSOR, "gpt-5",
        BackendType.CODEX, "gpt-5.3-codex"
    ));

    private static final Map<BackendType, String> DEFAULT_FALLBACK_MODELS = new EnumMap<>(Map.of(
        BackendType.CLAUDE, "sonnet",
        BackendType.GEMINI, "gemini-2.5-flash",
        BackendType.CURSOR, "gpt-5",
        BackendType.CODEX, "gpt-5"
    ));

    private final BackendType defaultBackend;
    private final Map<BackendType, String> defaultModels;

    public RunnerSelectionService(BackendType defaultBackend) {
        this(defaultBackend, Map.of());
    }

    /**
     * 백엔드별 기본 모델을 덮어써서 생성.
     *
     * @param defaultBackend 라우팅 신호가 없을 때의 백엔드
     * @param modelOverrides 백엔드별 기본 모델 (없는 항목은 내장 기본값)
     */
    public RunnerSelectionService(BackendType defaultBackend, Map<BackendType, String> modelOverrides) {
        if (defaultBackend == null) {
            throw new IllegalArgumentException("defaultBackend cannot be null");
        }
        this.defaultBackend = defaultBackend;
        this.defaultModels = new EnumMap<>(DEFAULT_MODELS);
        if (modelOverrides != null) {
            modelOverrides.forEach((backend, model) -> {
                if (model != null && !model.isBlank()) {
                    defaultModels.put(backend, model);
                }
            });
        }
    }

    public BackendType defaultBackend() {
        return defaultBackend;
    }

    public String defaultModelFor(BackendType backend) {
        return defaultModels.get(backend);
    }

    public String defaultFallbackModelFor(BackendType backend) {
        return DEFAULT_FALLBACK_MODELS.get(backend);
    }

    /**
     * 라우팅 신호로 백엔드와 모델 결정.
     *
     * @param labels 작업 항목 라벨 (대소문자 무시)
     * @param description 작업 항목 설명 (태그 검색용, null 허용)
     * @return 선택 결과
     */
    public RunnerSelection select(List<String> labels, String description) {
        List<String> normalizedLabels = labels == null ? List.of() : labels.stream()
            .filter(label -> label != null)
            .map(label -> label.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());

        Optional<BackendType> agentFromDescription = parseDescriptionTag(description, "agent")
            .flatMap(RunnerSelectionService::backendForAgentName);
        Optional<BackendType> agentFromLabels = backendFromLabels(normalizedLabels);
        String explicitModel = parseDescriptionTag(description, "model")
            .orElseGet(() -> modelFromLabels(normalizedLabels).orElse(null));
        Optional<BackendType> modelBackend = inferBackendFromModel(explicitModel);

        BackendType backend = agentFromDescription
            .or(() -> agentFromLabels)
            .or(() -> modelBackend)
            .orElse(defaultBackend);

        String model = explicitModel;
        if (model != null && modelBackend.isPresent() && modelBackend.get() != backend) {
            log.debug("Ignoring model {} that does not belong to backend {}", model, backend.key());
            model = null;
        }
        if (model == null) {
            model = defaultModels.get(backend);
        }
        String fallbackModel = inferFallbackModel(model, backend);
        return new RunnerSelection(backend, model, fallbackModel);
    }

    /**
     * 설명에서 {@code [tag=value]} 값을 추출 (마크다운 이스케이프 {@code \[ \]} 허용).
     *
     * @param description 설명
     * @param tagName 태그 이름
     * @return 값
     */
    public static Optional<String> parseDescriptionTag(String description, String tagName) {
        if (description == null || description.isEmpty()) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile("\\\\?\\[" + Pattern.quote(tagName) + "=([a-zA-Z0-9_.:/-]+)\\\\?\\]",
            Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(description);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<BackendType> backendForAgentName(String agent) {
        switch (agent.toLowerCase(Locale.ROOT)) {
            case "cursor":
                return Optional.of(BackendType.CURSOR);
            case "codex":
            case "openai":
                return Optional.of(BackendType.CODEX);
            case "gemini":
                return Optional.of(BackendType.GEMINI);
            case "claude":
                return Optional.of(BackendType.CLAUDE);
            default:
                return Optional.empty();
        }
    }

    private static Optional<BackendType> backendFromLabels(List<String> labels) {
        if (labels.contains("cursor")) {
            return Optional.of(BackendType.CURSOR);
        }
        if (labels.contains("codex") || labels.contains("openai")) {
            return Optional.of(BackendType.CODEX);
        }
        if (labels.contains("gemini")) {
            return Optional.of(BackendType.GEMINI);
        }
        if (labels.contains("claude") || labels.contains("opus")) {
            return Optional.of(BackendType.CLAUDE);
        }
        return Optional.empty();
    }

    private static Optional<String> modelFromLabels(List<String> labels) {
        Optional<String> codexModel = labels.stream()
            .filter(label -> CODEX_MODEL_SUFFIX.matcher(label).find())
            .findFirst();
        if (codexModel.isPresent()) {
            return codexModel;
        }
        if (labels.contains("gemini-2.5-pro") || labels.contains("gemini-2.5")) {
            return Optional.of("gemini-2.5-pro");
        }
        if (labels.contains("gemini-2.5-flash")) {
            return Optional.of("gemini-2.5-flash");
        }
        if (labels.contains("gemini-2.5-flash-lite")) {
            return Optional.of("gemini-2.5-flash-lite");
        }
        if (labels.contains("gemini-3") || labels.contains("gemini-3-pro") || labels.contains("gemini-3-pro-preview")) {
            return Optional.of("gemini-3-pro-preview");
        }
        for (String claudeModel : List.of("opus", "sonnet", "haiku")) {
            if (labels.contains(claudeModel)) {
                return Optional.of(claudeModel);
            }
        }
        return Optional.empty();
    }

    static Optional<BackendType> inferBackendFromModel(String model) {
        if (model == null || model.isBlank()) {
            return Optional.empty();
        }
        String normalized = model.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("gemini")) {
            return Optional.of(BackendType.GEMINI);
        }
        if (normalized.equals("opus") || normalized.equals("sonnet") || normalized.equals("haiku")
            || normalized.startsWith("claude")) {
            return Optional.of(BackendType.CLAUDE);
        }
        if (isCodexModel(normalized)) {
            return Optional.of(BackendType.CODEX);
        }
        return Optional.empty();
    }

    static String inferFallbackModel(String model, BackendType backend) {
        String normalized = model.toLowerCase(Locale.ROOT);
        if (backend == BackendType.CLAUDE) {
            switch (normalized) {
                case "opus":
                    return "sonnet";
                case "sonnet":
                    return "haiku";
                default:
                    return "sonnet";
            }
        }
        if (backend == BackendType.GEMINI) {
            switch (normalized) {
                case "gemini-3":
                case "gemini-3-pro":
                case "gemini-3-pro-preview":
                    return "gemini-2.5-pro";
                case "gemini-2.5-pro":
                case "gemini-2.5":
                    return "gemini-2.5-flash";
                case "gemini-2.5-flash":
                case "gemini-2.5-flash-lite":
                    return "gemini-2.5-flash-lite";
                default:
                    return "gemini-2.5-flash";
            }
        }
        if (isCodexModel(normalized) && normalized.endsWith("-codex")) {
            return model.substring(0, model.length() - "-codex".length());
        }
        return "gpt-5";
    }

    private static boolean isCodexModel(String model) {
        return CODEX_MODEL_SUFFIX.matcher(model).find() || GPT_MODEL.matcher(model).matches();
    }
}
