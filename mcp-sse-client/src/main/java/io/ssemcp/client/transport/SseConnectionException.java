/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.client.transport;

/**
 * 事件流无法打开时抛出，例如服务器返回非成功状态码，或者响应不是事件流。
 */
public class SseConnectionException extends RuntimeException {

	private final int statusCode;

	/**
	 * @param message 错误信息
	 * @param statusCode 与错误相关的HTTP状态码
	 */
	public SseConnectionException(final String message, final int statusCode) {
		super(message + " (Status code: " + statusCode + ")");
		this.statusCode = statusCode;
	}

	/**
	 * 获取与此异常相关的HTTP状态码。
	 * @return HTTP状态码
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * 检查状态码是否表示可以重试的错误。
	 * @return 状态码为408、429或在500-599范围内时返回true
	 */
	public boolean isRetryable() {
		return statusCode == 408 || statusCode == 429 || (statusCode >= 500 && statusCode < 600);
	}

}
