package com.seqflow.core.target;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "seqflow.storage")
public class StorageProperties {

    private String mirrorRoot = "";
    private List<String> mirrorSchemes = new ArrayList<>(List.of("s3"));
    private Gcs gcs = new Gcs();

    public boolean isMirrorConfigured() {
        return mirrorRoot != null && !mirrorRoot.isBlank();
    }

    public String getMirrorRoot() { return mirrorRoot; }
    public void setMirrorRoot(String mirrorRoot) { this.mirrorRoot = mirrorRoot; }
    public List<String> getMirrorSchemes() { return mirrorSchemes; }
    public void setMirrorSchemes(List<String> mirrorSchemes) { this.mirrorSchemes = mirrorSchemes; }
    public Gcs getGcs() { return gcs; }
    public void setGcs(Gcs gcs) { this.gcs = gcs; }

    public static class Gcs {
        private boolean enabled = false;
        private String projectId = "";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }
    }
}
