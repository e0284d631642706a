package com.platform.resilience.error;

/**
 * Exception when a persisted artifact is not found.
 */
public class ArtifactNotFoundException extends ResilienceException {
    
    private final String artifactType;
    private final String artifactKey;
    
    public ArtifactNotFoundException(String artifactType, String artifactKey) {
        super(ErrorCode.ARTIFACT_NOT_FOUND, 
            String.format("%s not found: %s", artifactType, artifactKey));
        this.artifactType = artifactType;
        this.artifactKey = artifactKey;
    }
    
    public String getArtifactType() {
        return artifactType;
    }
    
    public String getArtifactKey() {
        return artifactKey;
    }
}
