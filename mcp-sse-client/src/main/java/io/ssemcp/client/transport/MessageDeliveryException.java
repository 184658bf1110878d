/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.client.transport;

import java.net.URI;

/**
 * 向提交端点POST消息时服务器返回了400及以上的状态码。
 *
 * <p>
 * 投递失败只表示消息没有被接收，对应的请求仍由其超时计时器管理。
 */
public class MessageDeliveryException extends RuntimeException {

	private final URI target;

	private final int statusCode;

	private final String responseBody;

	public MessageDeliveryException(URI target, int statusCode, String responseBody) {
		super("POST " + target + " failed: " + statusCode + " " + responseBody);
		this.target = target;
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public URI getTarget() {
		return target;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getResponseBody() {
		return responseBody;
	}

}
