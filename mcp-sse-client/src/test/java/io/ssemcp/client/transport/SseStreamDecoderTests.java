/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.client.transport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.ssemcp.spec.StreamEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link SseStreamDecoder}的行重组测试。
 */
class SseStreamDecoderTests {

	private static final String MIXED_STREAM = "event: endpoint\r\n" + "data: /messages/?session_id=abc123\r\n" + "\r\n"
			+ ": keep-alive\n" + "\n" + "id: 42\n" + "event: message\n"
			+ "data: {\"jsonrpc\":\"2.0\",\"id\":\"ping_1\",\"result\":{\"text\":\"héllo 世界 🎉\"}}\n"
			+ "data: {\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\"}\n" + "\n" + "data: ünïcödé\r" + "\r"
			+ "event: session\r\n" + "data: session_id=xyz\n\n";

	private static List<StreamEvent> decodeWhole(String text) {
		SseStreamDecoder decoder = new SseStreamDecoder();
		List<StreamEvent> events = decoder.decode(text.getBytes(StandardCharsets.UTF_8));
		decoder.finish();
		return events;
	}

	@Test
	void reassemblesEventsOnBlankLines() {
		List<StreamEvent> events = decodeWhole(MIXED_STREAM);

		assertThat(events).containsExactly(new StreamEvent("endpoint", null, "/messages/?session_id=abc123"),
				new StreamEvent("message", "42",
						"{\"jsonrpc\":\"2.0\",\"id\":\"ping_1\",\"result\":{\"text\":\"héllo 世界 🎉\"}}\n"
								+ "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\"}"),
				new StreamEvent(null, null, "ünïcödé"), new StreamEvent("session", null, "session_id=xyz"));
	}

	@Test
	void fieldValuesAreTrimmed() {
		assertThat(decodeWhole("event:   endpoint  \ndata:   /messages/  \n\n"))
			.containsExactly(new StreamEvent("endpoint", null, "/messages/"));
	}

	@Test
	void typeAndIdAreClearedAfterEachEvent() {
		assertThat(decodeWhole("id: 1\nevent: first\ndata: a\n\ndata: b\n\n"))
			.containsExactly(new StreamEvent("first", "1", "a"), new StreamEvent(null, null, "b"));
	}

	@Test
	void blankLineWithoutDataEmitsNothingAndKeepsType() {
		assertThat(decodeWhole("event: endpoint\n\n\n\ndata: /messages/\n\n"))
			.containsExactly(new StreamEvent("endpoint", null, "/messages/"));
	}

	@Test
	void emptyDataLineStillProducesEvent() {
		assertThat(decodeWhole("data:\n\n")).containsExactly(new StreamEvent(null, null, ""));
	}

	@Test
	void unknownLinesAreIgnored() {
		assertThat(decodeWhole(": comment\nretry: 1000\ncontinuation\n data: indented\ndata: kept\n\n"))
			.containsExactly(new StreamEvent(null, null, "kept"));
	}

	@Test
	void streamEndDoesNotFlushTrailingEvent() {
		SseStreamDecoder decoder = new SseStreamDecoder();

		List<StreamEvent> events = decoder.decode("data: a\n\ndata: b\n".getBytes(StandardCharsets.UTF_8));
		decoder.finish();

		assertThat(events).containsExactly(new StreamEvent(null, null, "a"));
	}

	@Test
	void everyTwoWaySplitYieldsTheSameEvents() {
		byte[] bytes = MIXED_STREAM.getBytes(StandardCharsets.UTF_8);
		List<StreamEvent> expected = decodeWhole(MIXED_STREAM);

		for (int split = 0; split <= bytes.length; split++) {
			SseStreamDecoder decoder = new SseStreamDecoder();
			List<StreamEvent> events = new ArrayList<>(decoder.decode(Arrays.copyOfRange(bytes, 0, split)));
			events.addAll(decoder.decode(Arrays.copyOfRange(bytes, split, bytes.length)));
			decoder.finish();

			assertThat(events).as("split at byte %d", split).isEqualTo(expected);
		}
	}

	@Test
	void byteByByteFeedingYieldsTheSameEvents() {
		byte[] bytes = MIXED_STREAM.getBytes(StandardCharsets.UTF_8);
		SseStreamDecoder decoder = new SseStreamDecoder();
		List<StreamEvent> events = new ArrayList<>();

		for (byte b : bytes) {
			events.addAll(decoder.decode(new byte[] { b }));
		}
		decoder.finish();

		assertThat(events).isEqualTo(decodeWhole(MIXED_STREAM));
	}

}
