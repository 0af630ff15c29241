package com.z254.robi.llm;

import com.z254.robi.domain.model.ConversationMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The text generator behind the robot's voice.
 */
public interface GenerativeBackend {

    /**
     * Stream a reply to one turn. The flux is finite, cold and may fail once.
     *
     * @param history prior messages of the session, ordered
     * @param turn    the user's input for this turn
     * @param context memory and location context, possibly blank
     * @return raw text fragments, control tags included
     */
    Flux<String> streamResponse(List<ConversationMessage> history, TurnInput turn, String context);

    /**
     * One non-streamed completion.
     *
     * @param instruction what to do with the content
     * @param content     material to work on
     * @return the full generated text
     */
    Mono<String> complete(String instruction, String content);
}
