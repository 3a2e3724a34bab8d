/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

import java.util.List;
import java.util.Map;

import com.agui.sdk.spec.AgUiSchema;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SessionReducer}.
 */
class SessionReducerTest {

	@Test
	void simpleTextRunProducesAssistantMessage() {
		Session session = SessionReducer.applyAll(Session.create(), List.of(new AgUiSchema.RunStarted("t1", "r1"),
				new AgUiSchema.TextMessageStart("m1", "assistant"), new AgUiSchema.TextMessageContent("m1", "Hello!"),
				new AgUiSchema.TextMessageEnd("m1"), new AgUiSchema.RunFinished("t1", "r1")));

		assertThat(session.messages()).containsExactly(new AgUiSchema.AssistantMessage("m1", "Hello!"));
		assertThat(session.status()).isEqualTo(RunStatus.FINISHED);
		assertThat(session.threadId()).isEqualTo("t1");
		assertThat(session.runId()).isEqualTo("r1");
		assertThat(session.isStreaming()).isFalse();
	}

	@Test
	void contentAccumulatesWhileStreaming() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.RunStarted("t1", "r1"), new AgUiSchema.TextMessageStart("m1", "assistant"),
						new AgUiSchema.TextMessageContent("m1", "Hello "),
						new AgUiSchema.TextMessageContent("m1", "World!")));

		assertThat(session.streamingText("m1")).contains("Hello World!");
		assertThat(session.messages()).isEmpty();
		assertThat(session.isStreaming()).isTrue();
	}

	@Test
	void textMessageRoleSelectsMessageType() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.TextMessageStart("u1", "user"), new AgUiSchema.TextMessageContent("u1", "Hi"),
						new AgUiSchema.TextMessageEnd("u1")));

		assertThat(session.messages()).containsExactly(new AgUiSchema.UserMessage("u1", "Hi"));
	}

	@Test
	void runFinishedFlushesOpenTextMessages() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.RunStarted("t1", "r1"), new AgUiSchema.TextMessageStart("m1", "assistant"),
						new AgUiSchema.TextMessageContent("m1", "partial"), new AgUiSchema.RunFinished("t1", "r1")));

		assertThat(session.messages()).containsExactly(new AgUiSchema.AssistantMessage("m1", "partial"));
		assertThat(session.textBuffers()).isEmpty();
	}

	@Test
	void toolCallAttachesToStreamingParentMessage() {
		Session session = SessionReducer.applyAll(Session.create(), List.of(new AgUiSchema.RunStarted("t1", "r1"),
				new AgUiSchema.TextMessageStart("m1", "assistant"), new AgUiSchema.TextMessageContent("m1", "Checking"),
				new AgUiSchema.ToolCallStart("tc1", "search", "m1"), new AgUiSchema.ToolCallArgs("tc1", "{\"q\":"),
				new AgUiSchema.ToolCallArgs("tc1", "\"java\"}"), new AgUiSchema.ToolCallEnd("tc1"),
				new AgUiSchema.TextMessageEnd("m1"), new AgUiSchema.RunFinished("t1", "r1")));

		assertThat(session.messages()).containsExactly(new AgUiSchema.AssistantMessage("m1", "Checking",
				List.of(new AgUiSchema.ToolCall("tc1", "search", "{\"q\":\"java\"}"))));
	}

	@Test
	void toolCallAttachesToFinishedAssistantMessage() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.TextMessageStart("m1", "assistant"), new AgUiSchema.TextMessageEnd("m1"),
						new AgUiSchema.ToolCallStart("tc1", "search", "m1"), new AgUiSchema.ToolCallEnd("tc1")));

		AgUiSchema.AssistantMessage message = (AgUiSchema.AssistantMessage) session.findMessage("m1").orElseThrow();
		assertThat(message.toolCalls()).containsExactly(new AgUiSchema.ToolCall("tc1", "search", ""));
		assertThat(session.messages()).hasSize(1);
	}

	@Test
	void toolCallWithoutParentGetsOwnAssistantMessage() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.ToolCallStart("tc1", "search", null), new AgUiSchema.ToolCallArgs("tc1", "{}"),
						new AgUiSchema.ToolCallEnd("tc1"),
						new AgUiSchema.ToolCallResult("r1", "tc1", "found it")));

		assertThat(session.messages()).containsExactly(
				new AgUiSchema.AssistantMessage("tc1", null,
						List.of(new AgUiSchema.ToolCall("tc1", "search", "{}"))),
				new AgUiSchema.ToolMessage("r1", "found it", "tc1"));
	}

	@Test
	void toolArgsAreVisibleWhileStreaming() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.ToolCallStart("tc1", "search", null), new AgUiSchema.ToolCallArgs("tc1", "{")));

		assertThat(session.streamingToolArgs("tc1")).contains("{");
	}

	@Test
	void unknownIdsLeaveSessionUnchanged() {
		Session session = Session.create("t1");

		assertThat(SessionReducer.apply(session, new AgUiSchema.ToolCallArgs("nope", "x"))).isEqualTo(session);
		assertThat(SessionReducer.apply(session, new AgUiSchema.ToolCallEnd("nope"))).isEqualTo(session);
		assertThat(SessionReducer.apply(session, new AgUiSchema.TextMessageEnd("nope"))).isEqualTo(session);
		assertThat(SessionReducer.apply(session,
				new AgUiSchema.ActivityDelta("nope", "PLAN", List.of(AgUiSchema.JsonPatchOperation.add("/a", 1)))))
			.isEqualTo(session);
	}

	@Test
	void stateSnapshotThenDelta() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.StateSnapshot(Map.of("counter", 0, "items", List.of("a", "b"))),
						new AgUiSchema.StateDelta(List.of(AgUiSchema.JsonPatchOperation.replace("/counter", 1),
								AgUiSchema.JsonPatchOperation.add("/items/-", "c")))));

		assertThat(session.state()).isEqualTo(Map.of("counter", 1, "items", List.of("a", "b", "c")));
	}

	@Test
	void messagesSnapshotReplacesConversation() {
		Session session = Session.create().mutate().addMessage(new AgUiSchema.UserMessage("old", "x")).build();

		Session updated = SessionReducer.apply(session,
				new AgUiSchema.MessagesSnapshot(List.of(new AgUiSchema.UserMessage("u1", "Hi"),
						new AgUiSchema.AssistantMessage("a1", "Hello"))));

		assertThat(updated.messages()).extracting(AgUiSchema.Message::id).containsExactly("u1", "a1");
	}

	@Test
	void runErrorRecordsMessage() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.RunStarted("t1", "r1"), new AgUiSchema.RunError("boom")));

		assertThat(session.isErrored()).isTrue();
		assertThat(session.errorMessage()).isEqualTo("boom");
	}

	@Test
	void runErrorDiscardsStreamingBuffers() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.RunStarted("t1", "r1"), new AgUiSchema.TextMessageStart("m1", "assistant"),
						new AgUiSchema.TextMessageContent("m1", "par"),
						new AgUiSchema.ToolCallStart("tc1", "search", null), new AgUiSchema.ThinkingStart(),
						new AgUiSchema.RunError("boom")));

		assertThat(session.isErrored()).isTrue();
		assertThat(session.textBuffers()).isEmpty();
		assertThat(session.toolBuffers()).isEmpty();
		assertThat(session.thinking().active()).isFalse();
		assertThat(session.messages()).isEmpty();
	}

	@Test
	void runStartedResetsRunScopedState() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.RunStarted("t1", "r1"), new AgUiSchema.StepStarted("plan"),
						new AgUiSchema.RunError("boom"), new AgUiSchema.RunStarted("t1", "r2")));

		assertThat(session.isRunning()).isTrue();
		assertThat(session.runId()).isEqualTo("r2");
		assertThat(session.errorMessage()).isNull();
		assertThat(session.steps()).isEmpty();
	}

	@Test
	void stepsAreTracked() {
		Session session = SessionReducer.applyAll(Session.create(), List.of(new AgUiSchema.StepStarted("plan"),
				new AgUiSchema.StepStarted("act"), new AgUiSchema.StepFinished("plan")));

		assertThat(session.findStep("plan")).get().satisfies(step -> assertThat(step.isFinished()).isTrue());
		assertThat(session.findStep("act")).get().satisfies(step -> assertThat(step.isFinished()).isFalse());
		assertThat(session.findStep("other")).isEmpty();
	}

	@Test
	void activitySnapshotAndDelta() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.ActivitySnapshot("plan-1", "PLAN", Map.of("done", false)),
						new AgUiSchema.ActivityDelta("plan-1", "PLAN",
								List.of(AgUiSchema.JsonPatchOperation.replace("/done", true)))));

		assertThat(session.messages())
			.containsExactly(new AgUiSchema.ActivityMessage("plan-1", "PLAN", Map.of("done", true)));
	}

	@Test
	void activitySnapshotWithoutReplaceKeepsExistingMessage() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.ActivitySnapshot("plan-1", "PLAN", Map.of("v", 1)),
						new AgUiSchema.ActivitySnapshot("plan-1", "PLAN", Map.of("v", 2), false, null, null),
						new AgUiSchema.ActivitySnapshot("plan-2", "PLAN", Map.of("v", 3), false, null, null)));

		assertThat(session.messages()).containsExactly(new AgUiSchema.ActivityMessage("plan-1", "PLAN", Map.of("v", 1)),
				new AgUiSchema.ActivityMessage("plan-2", "PLAN", Map.of("v", 3)));
	}

	@Test
	void thinkingIsTracked() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.ThinkingStart(), new AgUiSchema.ThinkingTextMessageStart(),
						new AgUiSchema.ThinkingTextMessageContent("Let me "),
						new AgUiSchema.ThinkingTextMessageContent("think")));

		assertThat(session.thinking().active()).isTrue();
		assertThat(session.thinking().content()).isEqualTo("Let me think");
		assertThat(SessionReducer.apply(session, new AgUiSchema.ThinkingEnd()).thinking().active()).isFalse();
	}

	@Test
	void chunksAreReducedDirectly() {
		Session session = SessionReducer.applyAll(Session.create(),
				List.of(new AgUiSchema.TextMessageChunk("m1", "assistant", "Hel"),
						new AgUiSchema.TextMessageChunk("m1", null, "lo"),
						new AgUiSchema.ToolCallChunk("tc1", "search", null, "{}")));

		assertThat(session.streamingText("m1")).contains("Hello");
		assertThat(session.streamingToolArgs("tc1")).contains("{}");
	}

	@Test
	void rawAndCustomEventsAreIgnored() {
		Session session = Session.create();

		assertThat(SessionReducer.apply(session, new AgUiSchema.Raw(Map.of(), null))).isEqualTo(session);
		assertThat(SessionReducer.apply(session, new AgUiSchema.Custom("x", 1))).isEqualTo(session);
	}

	@Test
	void reduceEmitsOneSessionPerEvent() {
		Flux<AgUiSchema.Event> events = Flux.just(new AgUiSchema.RunStarted("t1", "r1"),
				new AgUiSchema.RunFinished("t1", "r1"));

		StepVerifier.create(SessionReducer.reduce(events, Session.create()))
			.assertNext(session -> assertThat(session.isRunning()).isTrue())
			.assertNext(session -> assertThat(session.isFinished()).isTrue())
			.verifyComplete();
	}

}
