package io.github.hongjungwan.zkvault.core.diagnostics;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.core.project.ProjectRegistry;
import io.github.hongjungwan.zkvault.core.store.StoreKeys;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 자가 진단. 저장소 연결, 프로젝트 메타데이터, 설정된 환경 존재 여부 확인.
 */
@Slf4j
public class VaultDoctor {

    static final String STORE_CONNECTIVITY = "Store Connectivity";
    static final String PROJECT_METADATA = "Project Metadata";
    static final String ENVIRONMENT = "Environment";

    private final VaultConfig config;
    private final SecretStore store;
    private final ProjectRegistry projectRegistry;

    public VaultDoctor(VaultConfig config, SecretStore store, ProjectRegistry projectRegistry) {
        this.config = config;
        this.store = store;
        this.projectRegistry = projectRegistry;
    }

    /**
     * 모든 진단 실행. 저장소에 연결할 수 없으면 나머지 검사는 건너뜀.
     */
    public DiagnosticReport diagnose() {
        log.info("Running zkvault diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        DiagnosticResult connectivity = checkStoreConnectivity();
        results.add(connectivity);

        if (connectivity.isFailure()) {
            results.add(DiagnosticResult.warning(PROJECT_METADATA, "Skipped: store unreachable"));
            results.add(DiagnosticResult.warning(ENVIRONMENT, "Skipped: store unreachable"));
        } else {
            DiagnosticResult metadata = checkProjectMetadata();
            results.add(metadata);
            results.add(metadata.isSuccess()
                    ? checkEnvironment()
                    : DiagnosticResult.warning(ENVIRONMENT, "Skipped: project metadata unavailable"));
        }

        DiagnosticReport report = new DiagnosticReport(results);
        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage()));
        } else {
            log.info("All diagnostic checks passed");
        }
        return report;
    }

    private DiagnosticResult checkStoreConnectivity() {
        try {
            return store.ping()
                    ? DiagnosticResult.success(STORE_CONNECTIVITY, "Store responded to PING")
                    : DiagnosticResult.failure(STORE_CONNECTIVITY, "Store did not respond to PING");
        } catch (RuntimeException e) {
            return DiagnosticResult.failure(STORE_CONNECTIVITY, "Failed to connect: " + e.getMessage());
        }
    }

    private DiagnosticResult checkProjectMetadata() {
        String project = config.getProject();
        if (project == null || project.isBlank()) {
            return DiagnosticResult.warning(PROJECT_METADATA, "No project configured");
        }
        Map<String, String> meta = store.hgetAll(StoreKeys.metaKey(project));
        if (meta.isEmpty()) {
            return DiagnosticResult.failure(PROJECT_METADATA, "Project \"" + project + "\" is not registered");
        }
        if (!meta.containsKey(StoreKeys.FIELD_ENCRYPTED_PEK) || !meta.containsKey(StoreKeys.FIELD_SALT)) {
            return DiagnosticResult.failure(PROJECT_METADATA,
                    "Project \"" + project + "\" metadata is missing encryptedPEK or salt");
        }
        return DiagnosticResult.success(PROJECT_METADATA, "Project \"" + project + "\" is registered");
    }

    private DiagnosticResult checkEnvironment() {
        String environment = config.getEnvironment();
        List<String> environments = projectRegistry.listEnvironments(config.getProject());
        if (environments.contains(environment)) {
            return DiagnosticResult.success(ENVIRONMENT, "Environment \"" + environment + "\" exists");
        }
        return DiagnosticResult.warning(ENVIRONMENT, "Environment \"" + environment
                + "\" does not exist. Available: " + (environments.isEmpty() ? "none" : String.join(", ", environments)));
    }

    /**
     * 단일 진단 결과
     */
    @Getter
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public boolean isSuccess() {
            return status == Status.SUCCESS;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /**
     * 진단 보고서
     */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = List.copyOf(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return results;
        }

        public DiagnosticResult get(String name) {
            return results.stream()
                    .filter(result -> result.getName().equals(name))
                    .findFirst()
                    .orElse(null);
        }
    }
}
