package com.z254.robi.background;

import com.z254.robi.llm.TurnInput;
import com.z254.robi.tag.DecodedResponse;

import java.util.List;

/**
 * Everything the side-effect persister needs from a finished response cycle.
 *
 * @param sessionId     session the turn belongs to
 * @param requestId     request that produced it
 * @param input         what the user sent
 * @param response      decoded model output
 * @param personId      identity to attach person-scoped facts to, null when anonymous; when the
 *                      model named the person this is already the adopted slug
 * @param zoneName      robot location at the time of the turn, if known
 * @param faceEmbedding biometric sample captured at interaction start, if any
 */
public record TurnOutcome(String sessionId,
                          String requestId,
                          TurnInput input,
                          DecodedResponse response,
                          String personId,
                          String zoneName,
                          List<Float> faceEmbedding) {
}
