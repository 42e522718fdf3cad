package com.seqflow.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "seqflow")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getScratchRoot() { return sandbox.scratchRoot; }
    public String getSandboxRoot() { return sandbox.sandboxRoot; }
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public boolean isKeepFailedScratch() { return sandbox.keepFailedScratch; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private String provider = "docker";
        private String scratchRoot = System.getProperty("java.io.tmpdir") + "/seqflow-scratch";
        private String sandboxRoot = "/sandbox";
        private int timeoutSeconds = 0;
        private boolean keepFailedScratch = false;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getScratchRoot() { return scratchRoot; }
        public void setScratchRoot(String scratchRoot) { this.scratchRoot = scratchRoot; }
        public String getSandboxRoot() { return sandboxRoot; }
        public void setSandboxRoot(String sandboxRoot) { this.sandboxRoot = sandboxRoot; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public boolean isKeepFailedScratch() { return keepFailedScratch; }
        public void setKeepFailedScratch(boolean keepFailedScratch) { this.keepFailedScratch = keepFailedScratch; }
    }
}
