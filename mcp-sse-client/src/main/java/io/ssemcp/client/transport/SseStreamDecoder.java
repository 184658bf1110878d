/*
 * Copyright 2024 - 2024 the original author or authors.
 */
package io.ssemcp.client.transport;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import io.ssemcp.spec.StreamEvent;

/**
 * 把原始字节流逐块重组为{@link StreamEvent}的增量解码器，用于无法使用标准事件流解码时的回退读取。
 *
 * <p>
 * 字节按UTF-8解码后按{@code \n}、{@code \r\n}或{@code \r}分行，每行：
 * <ul>
 * <li>空行：缓冲区非空时输出一个事件（数据行以{@code \n}连接），并清空缓冲区、类型和ID；缓冲区为空时不做任何事</li>
 * <li>{@code event:}：设置当前类型为去掉首尾空白的剩余部分</li>
 * <li>{@code id:}：设置当前ID为去掉首尾空白的剩余部分</li>
 * <li>{@code data:}：把去掉首尾空白的剩余部分追加到缓冲区</li>
 * <li>其他行忽略</li>
 * </ul>
 * 流结束时不会补发最后一个事件。
 *
 * <p>
 * 多字节字符和CRLF可以被任意拆分在相邻的两块之间，输出与一次性输入整段字节相同。
 * 实例不是线程安全的，每个连接使用一个实例。
 */
public final class SseStreamDecoder {

	private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

	private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
		.onMalformedInput(CodingErrorAction.REPLACE)
		.onUnmappableCharacter(CodingErrorAction.REPLACE);

	/** 上一块末尾尚未组成完整字符的字节 */
	private ByteBuffer leftover = EMPTY;

	private final StringBuilder line = new StringBuilder();

	/** 上一个字符是{@code \r}，紧随其后的{@code \n}属于同一个换行 */
	private boolean afterCarriageReturn;

	private final List<String> dataLines = new ArrayList<>();

	private String eventType;

	private String id;

	public List<StreamEvent> decode(List<ByteBuffer> chunks) {
		List<StreamEvent> events = new ArrayList<>();
		for (ByteBuffer chunk : chunks) {
			decodeInto(chunk, events);
		}
		return events;
	}

	public List<StreamEvent> decode(ByteBuffer chunk) {
		List<StreamEvent> events = new ArrayList<>();
		decodeInto(chunk, events);
		return events;
	}

	public List<StreamEvent> decode(byte[] chunk) {
		return decode(ByteBuffer.wrap(chunk));
	}

	/**
	 * 标记流结束，丢弃未以换行结束的行以及未被空行结束的事件。
	 */
	public void finish() {
		this.leftover = EMPTY;
		this.utf8.reset();
		this.line.setLength(0);
		this.afterCarriageReturn = false;
		this.dataLines.clear();
		this.eventType = null;
		this.id = null;
	}

	private void decodeInto(ByteBuffer chunk, List<StreamEvent> events) {
		CharBuffer chars = decodeChars(chunk);
		while (chars.hasRemaining()) {
			char c = chars.get();
			if (this.afterCarriageReturn) {
				this.afterCarriageReturn = false;
				if (c == '\n') {
					continue;
				}
			}
			if (c == '\r') {
				this.afterCarriageReturn = true;
				endLine(events);
			}
			else if (c == '\n') {
				endLine(events);
			}
			else {
				this.line.append(c);
			}
		}
	}

	private CharBuffer decodeChars(ByteBuffer chunk) {
		ByteBuffer input;
		if (this.leftover.hasRemaining()) {
			input = ByteBuffer.allocate(this.leftover.remaining() + chunk.remaining());
			input.put(this.leftover).put(chunk).flip();
		}
		else {
			input = chunk;
		}
		CharBuffer out = CharBuffer.allocate(input.remaining() + 1);
		this.utf8.decode(input, out, false);
		out.flip();
		if (input.hasRemaining()) {
			ByteBuffer rest = ByteBuffer.allocate(input.remaining());
			rest.put(input).flip();
			this.leftover = rest;
		}
		else {
			this.leftover = EMPTY;
		}
		return out;
	}

	private void endLine(List<StreamEvent> events) {
		String current = this.line.toString();
		this.line.setLength(0);

		if (current.isEmpty()) {
			flush(events);
		}
		else if (current.startsWith("event:")) {
			this.eventType = current.substring(6).trim();
		}
		else if (current.startsWith("id:")) {
			this.id = current.substring(3).trim();
		}
		else if (current.startsWith("data:")) {
			this.dataLines.add(current.substring(5).trim());
		}
	}

	private void flush(List<StreamEvent> events) {
		if (this.dataLines.isEmpty()) {
			return;
		}
		events.add(new StreamEvent(this.eventType, this.id, String.join("\n", this.dataLines)));
		this.dataLines.clear();
		this.eventType = null;
		this.id = null;
	}

}
