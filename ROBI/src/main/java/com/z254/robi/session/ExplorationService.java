package com.z254.robi.session;

import com.z254.robi.api.websocket.ErrorCode;
import com.z254.robi.api.websocket.ServerMessage;
import com.z254.robi.llm.CompanionPrompts;
import com.z254.robi.llm.GenerativeBackend;
import com.z254.robi.motion.MotionCompiler;
import com.z254.robi.motion.MoveSequence;
import com.z254.robi.tag.DecodedResponse;
import com.z254.robi.tag.StreamingTagDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Autonomous movement modes that do not go through a full response cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExplorationService {

    static final int DEFAULT_DURATION_MINUTES = 5;
    static final String EXPLORATION_CONTENT = "Start exploring now.";

    private final GenerativeBackend generativeBackend;
    private final MotionCompiler motionCompiler;

    /**
     * Ask the model how to start exploring. Falls back to the default pattern when it
     * suggests no moves.
     */
    public Mono<ServerMessage> explore(String requestId, Integer durationMinutes) {
        int minutes = durationMinutes != null && durationMinutes > 0 ? durationMinutes : DEFAULT_DURATION_MINUTES;
        return generativeBackend.complete(CompanionPrompts.explorationInstruction(minutes), EXPLORATION_CONTENT)
                .defaultIfEmpty("")
                .map(StreamingTagDecoder::decodeComplete)
                .map(decoded -> ServerMessage.explorationActions(requestId, List.of(movesFor(decoded)),
                        decoded.getVisibleText().strip(), minutes))
                .onErrorResume(e -> {
                    log.error("Exploration planning failed for request {}", requestId, e);
                    return Mono.just(ServerMessage.error(requestId, ErrorCode.AGENT_ERROR,
                            "Failed to plan exploration: " + e.getMessage()));
                });
    }

    public Mono<ServerMessage> faceScan(String requestId) {
        return Mono.fromSupplier(() -> ServerMessage.faceScanActions(requestId,
                List.of(motionCompiler.faceScanSequence())));
    }

    private MoveSequence movesFor(DecodedResponse decoded) {
        if (decoded.getActions().isEmpty()) {
            log.debug("No exploration moves suggested, using the default pattern");
            return motionCompiler.defaultExplorationSequence();
        }
        return motionCompiler.buildMoveSequence("Exploration", decoded.getActions(), decoded.getEmotion().getTag());
    }
}
