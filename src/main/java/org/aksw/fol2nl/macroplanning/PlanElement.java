package org.aksw.fol2nl.macroplanning;

import java.util.List;

/**
 * A child of a {@link DocumentPlan}: either a {@link Message} or a sub-plan.
 */
public interface PlanElement {

	RhetoricalRelation getRelation();

	/**
	 * @return the messages below this element, in presentation order
	 */
	List<Message> getMessages();
}
