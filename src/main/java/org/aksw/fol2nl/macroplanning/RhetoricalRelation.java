package org.aksw.fol2nl.macroplanning;

/**
 * Discourse relations of a {@link DocumentPlan}.
 */
public enum RhetoricalRelation {
	/** the root: clusters presented one after the other */
	SEQUENCE,
	/** a message (or cluster) that adds detail to its nucleus */
	ELABORATION,
	/** the central message of a cluster */
	NUCLEUS;
}
