package me.go_gradually.phonedesk.infrastructure.shared.config;

import me.go_gradually.phonedesk.application.call.policy.CallPolicy;
import me.go_gradually.phonedesk.application.shared.policy.ServiceStatusPolicy;
import me.go_gradually.phonedesk.domain.disposition.InfoPrecedence;
import me.go_gradually.phonedesk.domain.gate.GatePolicy;
import me.go_gradually.phonedesk.domain.gate.GateTransition;
import me.go_gradually.phonedesk.domain.turn.InterruptionMode;
import me.go_gradually.phonedesk.domain.turn.TurnTimings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "phonedesk")
public class AppProperties implements CallPolicy, ServiceStatusPolicy {
    private String serviceName = "phonedesk";
    private Turn turn = new Turn();
    private Audio audio = new Audio();
    private Gates gates = new Gates();
    private Disposition disposition = new Disposition();
    private Recording recording = new Recording();
    private Notification notification = new Notification();
    private Memory memory = new Memory();
    private Script script = new Script();
    private Integrations integrations = new Integrations();

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public Turn getTurn() {
        return turn;
    }

    public void setTurn(Turn turn) {
        this.turn = turn;
    }

    public Audio getAudio() {
        return audio;
    }

    public void setAudio(Audio audio) {
        this.audio = audio;
    }

    public Gates getGates() {
        return gates;
    }

    public void setGates(Gates gates) {
        this.gates = gates;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public void setDisposition(Disposition disposition) {
        this.disposition = disposition;
    }

    public Recording getRecording() {
        return recording;
    }

    public void setRecording(Recording recording) {
        this.recording = recording;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public Memory getMemory() {
        return memory;
    }

    public void setMemory(Memory memory) {
        this.memory = memory;
    }

    public Script getScript() {
        return script;
    }

    public void setScript(Script script) {
        this.script = script;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    @Override
    public TurnTimings turnTimings() {
        return new TurnTimings(turn.getDebounceMs(),
                turn.getMinActivityFrames(),
                turn.getInterruptionMode(),
                turn.getBargeInMinMs(),
                turn.getBargeInCooldownMs(),
                turn.getAudioDropWindowMs());
    }

    @Override
    public int audioQueueCapacity() {
        return audio.getQueueCapacity();
    }

    @Override
    public GatePolicy gatePolicy() {
        return new GatePolicy(gates.isEarlyNameCapture(), gates.getEarlyNameWindowMs(), gates.getInfoAnswerMaxChars());
    }

    @Override
    public int maxNameChars() {
        return gates.getMaxNameChars();
    }

    @Override
    public int maxNameWords() {
        return gates.getMaxNameWords();
    }

    @Override
    public List<String> extraNameStopwords() {
        return gates.getExtraNameStopwords() == null ? List.of() : List.copyOf(gates.getExtraNameStopwords());
    }

    @Override
    public InfoPrecedence infoPrecedence() {
        return disposition.getInfoPrecedence();
    }

    @Override
    public Duration recordingTimeout() {
        return Duration.ofMillis(recording.getTimeoutMs());
    }

    @Override
    public Duration hangupAfterClosing() {
        return Duration.ofMillis(turn.getHangupAfterClosingMs());
    }

    @Override
    public String providerMode() {
        return notification.getProviderMode();
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public boolean notificationConfigured() {
        if (!isBlank(notification.getDefaultUrl())) {
            return true;
        }
        return notification.getUrls() != null
                && notification.getUrls().values().stream().anyMatch(url -> !isBlank(url));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static class Turn {
        private long debounceMs = 350;
        private int minActivityFrames = 4;
        private InterruptionMode interruptionMode = InterruptionMode.BARGE_IN;
        private long bargeInMinMs = 250;
        private long bargeInCooldownMs = 600;
        private long audioDropWindowMs = 300;
        private long hangupAfterClosingMs = 2500;

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public int getMinActivityFrames() {
            return minActivityFrames;
        }

        public void setMinActivityFrames(int minActivityFrames) {
            this.minActivityFrames = minActivityFrames;
        }

        public InterruptionMode getInterruptionMode() {
            return interruptionMode;
        }

        public void setInterruptionMode(InterruptionMode interruptionMode) {
            this.interruptionMode = interruptionMode;
        }

        public long getBargeInMinMs() {
            return bargeInMinMs;
        }

        public void setBargeInMinMs(long bargeInMinMs) {
            this.bargeInMinMs = bargeInMinMs;
        }

        public long getBargeInCooldownMs() {
            return bargeInCooldownMs;
        }

        public void setBargeInCooldownMs(long bargeInCooldownMs) {
            this.bargeInCooldownMs = bargeInCooldownMs;
        }

        public long getAudioDropWindowMs() {
            return audioDropWindowMs;
        }

        public void setAudioDropWindowMs(long audioDropWindowMs) {
            this.audioDropWindowMs = audioDropWindowMs;
        }

        public long getHangupAfterClosingMs() {
            return hangupAfterClosingMs;
        }

        public void setHangupAfterClosingMs(long hangupAfterClosingMs) {
            this.hangupAfterClosingMs = hangupAfterClosingMs;
        }
    }

    public static class Audio {
        private int queueCapacity = 400;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Gates {
        private boolean earlyNameCapture = true;
        private long earlyNameWindowMs = 20000;
        private int maxNameChars = 22;
        private int maxNameWords = 3;
        private int infoAnswerMaxChars = 600;
        private List<String> extraNameStopwords = new ArrayList<>();

        public boolean isEarlyNameCapture() {
            return earlyNameCapture;
        }

        public void setEarlyNameCapture(boolean earlyNameCapture) {
            this.earlyNameCapture = earlyNameCapture;
        }

        public long getEarlyNameWindowMs() {
            return earlyNameWindowMs;
        }

        public void setEarlyNameWindowMs(long earlyNameWindowMs) {
            this.earlyNameWindowMs = earlyNameWindowMs;
        }

        public int getMaxNameChars() {
            return maxNameChars;
        }

        public void setMaxNameChars(int maxNameChars) {
            this.maxNameChars = maxNameChars;
        }

        public int getMaxNameWords() {
            return maxNameWords;
        }

        public void setMaxNameWords(int maxNameWords) {
            this.maxNameWords = maxNameWords;
        }

        public int getInfoAnswerMaxChars() {
            return infoAnswerMaxChars;
        }

        public void setInfoAnswerMaxChars(int infoAnswerMaxChars) {
            this.infoAnswerMaxChars = infoAnswerMaxChars;
        }

        public List<String> getExtraNameStopwords() {
            return extraNameStopwords;
        }

        public void setExtraNameStopwords(List<String> extraNameStopwords) {
            this.extraNameStopwords = extraNameStopwords;
        }
    }

    public static class Disposition {
        private InfoPrecedence infoPrecedence = InfoPrecedence.REGARDLESS_OF_NAME;

        public InfoPrecedence getInfoPrecedence() {
            return infoPrecedence;
        }

        public void setInfoPrecedence(InfoPrecedence infoPrecedence) {
            this.infoPrecedence = infoPrecedence;
        }
    }

    public static class Recording {
        private long timeoutMs = 12000;
        private long initialRetryDelayMs = 1000;
        private double backoffMultiplier = 1.5;
        private long maxRetryDelayMs = 3000;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getInitialRetryDelayMs() {
            return initialRetryDelayMs;
        }

        public void setInitialRetryDelayMs(long initialRetryDelayMs) {
            this.initialRetryDelayMs = initialRetryDelayMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getMaxRetryDelayMs() {
            return maxRetryDelayMs;
        }

        public void setMaxRetryDelayMs(long maxRetryDelayMs) {
            this.maxRetryDelayMs = maxRetryDelayMs;
        }
    }

    public static class Notification {
        private String defaultUrl = "";
        private Map<String, String> urls = new LinkedHashMap<>();
        private long timeoutMs = 5000;
        private String providerMode = "openai-realtime";

        public String getDefaultUrl() {
            return defaultUrl;
        }

        public void setDefaultUrl(String defaultUrl) {
            this.defaultUrl = defaultUrl;
        }

        public Map<String, String> getUrls() {
            return urls;
        }

        public void setUrls(Map<String, String> urls) {
            this.urls = urls;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getProviderMode() {
            return providerMode;
        }

        public void setProviderMode(String providerMode) {
            this.providerMode = providerMode;
        }
    }

    public static class Memory {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Script {
        private Map<String, String> settings = new LinkedHashMap<>();
        private String instructions = "";
        private String greeting = "";
        private String returningGreeting = "";
        private String closingUtterance = "";
        private List<Rule> rules = new ArrayList<>();

        public Map<String, String> getSettings() {
            return settings;
        }

        public void setSettings(Map<String, String> settings) {
            this.settings = settings;
        }

        public String getInstructions() {
            return instructions;
        }

        public void setInstructions(String instructions) {
            this.instructions = instructions;
        }

        public String getGreeting() {
            return greeting;
        }

        public void setGreeting(String greeting) {
            this.greeting = greeting;
        }

        public String getReturningGreeting() {
            return returningGreeting;
        }

        public void setReturningGreeting(String returningGreeting) {
            this.returningGreeting = returningGreeting;
        }

        public String getClosingUtterance() {
            return closingUtterance;
        }

        public void setClosingUtterance(String closingUtterance) {
            this.closingUtterance = closingUtterance;
        }

        public List<Rule> getRules() {
            return rules;
        }

        public void setRules(List<Rule> rules) {
            this.rules = rules;
        }
    }

    public static class Rule {
        private String id;
        private String pattern;
        private GateTransition transition;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public GateTransition getTransition() {
            return transition;
        }

        public void setTransition(GateTransition transition) {
            this.transition = transition;
        }
    }

    public static class Integrations {
        private Openai openai = new Openai();
        private Twilio twilio = new Twilio();

        public Openai getOpenai() {
            return openai;
        }

        public void setOpenai(Openai openai) {
            this.openai = openai;
        }

        public Twilio getTwilio() {
            return twilio;
        }

        public void setTwilio(Twilio twilio) {
            this.twilio = twilio;
        }
    }

    public static class Openai {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        private String model = "gpt-4o-realtime-preview";
        private String voice = "alloy";
        private String transcriptionModel = "whisper-1";
        private Vad vad = new Vad();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public String getTranscriptionModel() {
            return transcriptionModel;
        }

        public void setTranscriptionModel(String transcriptionModel) {
            this.transcriptionModel = transcriptionModel;
        }

        public Vad getVad() {
            return vad;
        }

        public void setVad(Vad vad) {
            this.vad = vad;
        }
    }

    public static class Vad {
        private double threshold = 0.5;
        private int prefixPaddingMs = 300;
        private int silenceDurationMs = 500;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getPrefixPaddingMs() {
            return prefixPaddingMs;
        }

        public void setPrefixPaddingMs(int prefixPaddingMs) {
            this.prefixPaddingMs = prefixPaddingMs;
        }

        public int getSilenceDurationMs() {
            return silenceDurationMs;
        }

        public void setSilenceDurationMs(int silenceDurationMs) {
            this.silenceDurationMs = silenceDurationMs;
        }
    }

    public static class Twilio {
        private String baseUrl = "https://api.twilio.com";
        private String accountSid = "";
        private String authToken = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAccountSid() {
            return accountSid;
        }

        public void setAccountSid(String accountSid) {
            this.accountSid = accountSid;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }
    }
}
