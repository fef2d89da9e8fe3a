package net.agentcharter.domain.artifact;

import org.springframework.util.StringUtils;

/**
 * Persisted claim fields of one artifact kind for one agent.
 *
 * @param kind artifact kind
 * @param value produced value, or an empty value when never generated
 * @param valueSourceHash fingerprint of the charter {@code value} was generated from; empty when never produced
 * @param requestedHash fingerprint of the outstanding claim; empty when no job is outstanding
 */
public record ArtifactState(ArtifactKind kind,
                            ArtifactValue value,
                            String valueSourceHash,
                            String requestedHash) {

    public ArtifactState {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        valueSourceHash = valueSourceHash == null ? "" : valueSourceHash;
        requestedHash = requestedHash == null ? "" : requestedHash;
    }

    /**
     * Creates the state of a kind that has never been generated nor claimed.
     */
    public static ArtifactState empty(ArtifactKind kind) {
        return new ArtifactState(kind, null, "", "");
    }

    public boolean hasValue() {
        return value != null && value.isPresent();
    }

    public boolean hasOutstandingClaim() {
        return StringUtils.hasText(requestedHash);
    }

    public boolean isClaimedFor(String charterHash) {
        return StringUtils.hasText(charterHash) && charterHash.equals(requestedHash);
    }

    /**
     * Applies the freshness rule for the supplied charter fingerprint. A matching source hash is
     * fresh whatever the outstanding claim says.
     */
    public boolean isFreshFor(String charterHash, FreshnessPolicy policy) {
        if (policy == FreshnessPolicy.STICKY && hasValue()) {
            return true;
        }
        return StringUtils.hasText(charterHash) && charterHash.equals(valueSourceHash);
    }
}
