package in.co.kalabandhu.pojos;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the engine's wiring, for health checks.
 */
public class SystemStatus {
    private final boolean aiConfigured;
    private final String aiModel;              // null when no AI matcher is wired
    private final int activeAiCalls;
    private final List<String> availableProfessions;
    private final int totalProfessions;
    private final String tablesVersion;
    private final Map<String, Object> defaults;

    public SystemStatus(boolean aiConfigured, String aiModel, int activeAiCalls,
                        List<String> availableProfessions, String tablesVersion,
                        Map<String, Object> defaults) {
        this.aiConfigured = aiConfigured;
        this.aiModel = aiModel;
        this.activeAiCalls = activeAiCalls;
        this.availableProfessions = List.copyOf(availableProfessions);
        this.totalProfessions = this.availableProfessions.size();
        this.tablesVersion = tablesVersion;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public boolean isAiConfigured() { return aiConfigured; }
    public String getAiModel() { return aiModel; }
    public int getActiveAiCalls() { return activeAiCalls; }
    public List<String> getAvailableProfessions() { return availableProfessions; }
    public int getTotalProfessions() { return totalProfessions; }
    public String getTablesVersion() { return tablesVersion; }
    public Map<String, Object> getDefaults() { return defaults; }
}
