/**
 *
 */
package org.theseed.gapfill.reduce;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.ModelReaction;

/**
 * This object assigns reliability scores to reaction directions.  A low score indicates a suspect
 * reaction, so sorting candidates by ascending score causes the search to probe the suspect ones
 * first.  The score only affects the search order.
 *
 * The base score comes from an external source (usually biochemistry data) when one is provided.
 * Otherwise exchange, sink, demand and biomass reactions get a low default and every other reaction
 * a high one.  The base score is then boosted by 10% for each active reaction set that used the
 * reaction in the same direction.
 *
 * If metabolite charges are known, a reaction that moves charge across the extracellular boundary is
 * penalized in the direction that moves net positive charge out of the cell.  Boundary and biomass
 * reactions are exempt.
 */
public class ReliabilityScorer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReliabilityScorer.class);
    /** map of reaction IDs to direction scores from the external source */
    private Map<String, Map<Direction, Double>> baseScores;
    /** map of reaction IDs to net charge moved to the extracellular side by forward flux */
    private Map<String, Double> transportedCharges;

    /** default score for boundary and biomass reactions */
    public static final double BOUNDARY_SCORE = -10.0;
    /** default score for ordinary reactions */
    public static final double DEFAULT_SCORE = 1000.0;
    /** boost per active reaction set using a reaction */
    public static final double ACTIVE_BOOST = 0.1;
    /** penalty per unit of charge transported in the unfavorable direction */
    public static final double CHARGE_PENALTY = 50.0;
    /** prefixes of boundary and biomass reactions */
    private static final String[] BOUNDARY_PREFIXES = new String[] { "EX_", "SK_", "DM_", "bio" };

    /**
     * Construct a reliability scorer with no external scores.
     */
    public ReliabilityScorer() {
        this.baseScores = new HashMap<String, Map<Direction, Double>>();
        this.transportedCharges = new HashMap<String, Double>();
    }

    /**
     * Construct a reliability scorer with external base scores.
     *
     * @param baseScores	map of reaction IDs to direction scores
     */
    public ReliabilityScorer(Map<String, Map<Direction, Double>> baseScores) {
        this.baseScores = new HashMap<String, Map<Direction, Double>>(baseScores);
        this.transportedCharges = new HashMap<String, Double>();
    }

    /**
     * Store an external base score.
     *
     * @param reactionId	ID of the reaction
     * @param dir			direction to score
     * @param score			base score
     */
    public void setBaseScore(String reactionId, Direction dir, double score) {
        this.baseScores.computeIfAbsent(reactionId, x -> new EnumMap<Direction, Double>(Direction.class)).put(dir, score);
    }

    /**
     * @return the base score for a reaction direction
     *
     * @param reactionId	ID of the reaction
     * @param dir			direction to score
     */
    public double getBaseScore(String reactionId, Direction dir) {
        double retVal;
        Map<Direction, Double> scores = this.baseScores.get(reactionId);
        if (scores != null && scores.containsKey(dir))
            retVal = scores.get(dir);
        else if (isBoundary(reactionId))
            retVal = BOUNDARY_SCORE;
        else
            retVal = DEFAULT_SCORE;
        double charge = this.transportedCharges.getOrDefault(reactionId, 0.0);
        if (dir == Direction.REVERSE)
            charge = -charge;
        if (charge > 0.0)
            retVal += CHARGE_PENALTY * charge;
        return retVal;
    }

    /**
     * @return TRUE if a reaction is an exchange, sink, demand or biomass reaction
     *
     * @param reactionId	ID of the reaction to check
     */
    private static boolean isBoundary(String reactionId) {
        return StringUtils.startsWithAny(reactionId, BOUNDARY_PREFIXES);
    }

    /**
     * Compute the net charge each reaction moves to the extracellular side when run forward.  An extracellular
     * metabolite is one whose compartment suffix (the part after the last underscore) begins with
     * "e".  Metabolites with no known charge count as neutral.  Any previously computed charges are
     * replaced.
     *
     * @param reactions		reactions to analyze
     * @param charges		map of metabolite IDs to charges
     */
    public void computeTransportedCharges(Collection<ModelReaction> reactions, Map<String, Double> charges) {
        this.transportedCharges.clear();
        for (ModelReaction reaction : reactions) {
            if (! isBoundary(reaction.getId())) {
                double transported = 0.0;
                for (ModelReaction.Stoich stoich : reaction.getMetabolites()) {
                    String metabolite = stoich.getMetabolite();
                    if (StringUtils.substringAfterLast(metabolite, "_").startsWith("e"))
                        transported += stoich.getCoeff() * charges.getOrDefault(metabolite, 0.0);
                }
                if (transported != 0.0) {
                    log.debug("Reaction {} transports charge {}.", reaction.getId(), transported);
                    this.transportedCharges.put(reaction.getId(), transported);
                }
            }
        }
    }

    /**
     * @return the net charge a reaction moves out of the cell when run forward, or 0 if none was computed
     *
     * @param reactionId	ID of the reaction of interest
     */
    public double getTransportedCharge(String reactionId) {
        return this.transportedCharges.getOrDefault(reactionId, 0.0);
    }

    /**
     * Count the number of active reaction sets using each reaction direction.
     *
     * @param activeReactionSets	collection of reaction sets from prior solutions
     *
     * @return a map from each candidate to the number of sets containing it
     */
    protected static Map<CandidateReaction, Integer> countActive(Collection<? extends Collection<CandidateReaction>> activeReactionSets) {
        Map<CandidateReaction, Integer> retVal = new HashMap<CandidateReaction, Integer>();
        for (Collection<CandidateReaction> reactionSet : activeReactionSets) {
            for (CandidateReaction item : reactionSet)
                retVal.merge(item, 1, Integer::sum);
        }
        return retVal;
    }

    /**
     * Compute the reliability score of every candidate and store it in the candidate.
     *
     * @param candidates			candidates to score
     * @param activeReactionSets	collection of reaction sets from prior solutions
     */
    public void scoreCandidates(Collection<CandidateReaction> candidates,
            Collection<? extends Collection<CandidateReaction>> activeReactionSets) {
        Map<CandidateReaction, Integer> activeCounts = countActive(activeReactionSets);
        for (CandidateReaction candidate : candidates) {
            double score = this.getBaseScore(candidate.getReactionId(), candidate.getDirection());
            int count = activeCounts.getOrDefault(candidate, 0);
            score *= 1.0 + ACTIVE_BOOST * count;
            candidate.setReliability(score);
        }
    }

    /**
     * Score a list of candidates and sort it so the lowest scores come first.
     *
     * @param candidates			list of candidates to sort
     * @param activeReactionSets	collection of reaction sets from prior solutions
     */
    public void sortCandidates(List<CandidateReaction> candidates,
            Collection<? extends Collection<CandidateReaction>> activeReactionSets) {
        this.scoreCandidates(candidates, activeReactionSets);
        Collections.sort(candidates, Comparator.comparingDouble(CandidateReaction::getReliability));
        if (log.isDebugEnabled()) {
            for (CandidateReaction candidate : candidates)
                log.debug("Reliability of {} is {}.", candidate, candidate.getReliability());
        }
    }

}
