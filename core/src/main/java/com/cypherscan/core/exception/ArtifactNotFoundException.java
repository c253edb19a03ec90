package com.cypherscan.core.exception;

public class ArtifactNotFoundException extends UpstreamException {
    public ArtifactNotFoundException(String message) { super(message, 404); }
}
