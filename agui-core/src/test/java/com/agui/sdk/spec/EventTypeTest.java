/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.spec;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EventType}.
 */
class EventTypeTest {

	@Test
	void everyEventClassHasExactlyOneType() {
		Set<Class<?>> classes = Arrays.stream(EventType.values())
			.map(EventType::eventClass)
			.collect(Collectors.toSet());

		assertThat(EventType.values()).hasSize(26);
		assertThat(classes).hasSize(26);
		assertThat(AgUiSchema.Event.class.getPermittedSubclasses()).containsExactlyInAnyOrderElementsOf(classes);
	}

	@Test
	void wireNameRoundTrips() {
		for (EventType type : EventType.values()) {
			assertThat(EventType.fromWireName(type.wireName())).contains(type);
		}
	}

	@Test
	void unknownWireNameIsEmpty() {
		assertThat(EventType.fromWireName("text_message_start")).isEmpty();
		assertThat(EventType.fromWireName(null)).isEmpty();
	}

	@Test
	void onlyChunksAreChunks() {
		assertThat(Arrays.stream(EventType.values()).filter(EventType::isChunk))
			.containsExactly(EventType.TEXT_MESSAGE_CHUNK, EventType.TOOL_CALL_CHUNK);
	}

	@Test
	void requiredFieldsFollowWireNames() {
		assertThat(EventType.TOOL_CALL_RESULT.requiredFields()).containsExactly("messageId", "toolCallId", "content");
		assertThat(EventType.TEXT_MESSAGE_CHUNK.requiredFields()).isEmpty();
		assertThat(EventType.THINKING_START.requiredFields()).isEmpty();
	}

	@Test
	void eventReportsItsType() {
		assertThat(new AgUiSchema.ThinkingEnd().eventType()).isEqualTo(EventType.THINKING_END);
		assertThat(new AgUiSchema.Raw(Map.of(), "openai").eventType()).isEqualTo(EventType.RAW);
	}

}
