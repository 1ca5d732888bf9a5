package org.javai.reliability.store;

import org.javai.reliability.api.TargetKey;

/**
 * Key of one learning row: a candidate within a target.
 */
public record RowKey(TargetKey target, String candidateId) {

	public RowKey {
		if (target == null) {
			throw new IllegalArgumentException("target must not be null");
		}
		if (candidateId == null || candidateId.isBlank()) {
			throw new IllegalArgumentException("candidateId must not be blank");
		}
	}

	@Override
	public String toString() {
		return target.asString() + ":" + candidateId;
	}
}
