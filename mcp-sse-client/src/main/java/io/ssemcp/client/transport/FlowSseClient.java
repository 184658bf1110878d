/*
* Copyright 2024 - 2024 the original author or authors.
*/
package io.ssemcp.client.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import io.ssemcp.spec.StreamEvent;
import io.ssemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 使用Java的Flow API实现的服务器发送事件(SSE)客户端，按标准事件流格式解析响应体。
 *
 * <p>
 * 连接只有在服务器返回状态码200且{@code Content-Type}为{@code text/event-stream}时才算协商成功，
 * 否则{@link #open}以{@link SseConnectionException}失败，调用方可以换用其他方式读取同一地址。
 *
 * <p>
 * 客户端支持标准的SSE事件字段，包括：
 * <ul>
 * <li>event - 事件类型（如果未指定，默认为"message"）</li>
 * <li>id - 事件ID，在后续事件中保持，直到被新的id行替换</li>
 * <li>data - 事件负载数据，多个data行以{@code \n}连接</li>
 * </ul>
 * 以{@code :}开头的注释行被忽略，字段值开头的一个空格被去掉。
 *
 * @author Christian Tzolov
 */
public class FlowSseClient {

	private static final Logger logger = LoggerFactory.getLogger(FlowSseClient.class);

	private static final String EVENT_STREAM_MEDIA_TYPE = "text/event-stream";

	private static final String DEFAULT_EVENT_TYPE = "message";

	private final HttpClient httpClient;

	/**
	 * 使用指定的HTTP客户端创建新的FlowSseClient。
	 * @param httpClient 用于SSE连接的{@link HttpClient}实例
	 */
	public FlowSseClient(HttpClient httpClient) {
		Assert.notNull(httpClient, "httpClient must not be null");
		this.httpClient = httpClient;
	}

	/**
	 * 打开事件流。
	 *
	 * <p>
	 * 返回的Mono在收到响应头并协商成功后发出事件序列。事件序列只能订阅一次，取消订阅会中止底层请求。
	 * @param uri 事件流地址
	 * @param headers 附加的请求头
	 * @return 发出事件序列的Mono
	 */
	public Mono<Flux<StreamEvent>> open(URI uri, Map<String, String> headers) {
		return Mono.defer(() -> {
			HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
				.header("Accept", EVENT_STREAM_MEDIA_TYPE)
				.header("Cache-Control", "no-cache")
				.GET();
			headers.forEach(builder::setHeader);

			Sinks.Many<StreamEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
			CompletableFuture<Void> negotiation = new CompletableFuture<>();

			CompletableFuture<HttpResponse<Void>> exchange = this.httpClient.sendAsync(builder.build(), info -> {
				String contentType = info.headers().firstValue("Content-Type").orElse("");
				if (info.statusCode() != 200 || !isEventStream(contentType)) {
					negotiation.completeExceptionally(new SseConnectionException(
							"Not an event stream: content type '" + contentType + "'", info.statusCode()));
					return HttpResponse.BodySubscribers.replacing(null);
				}
				negotiation.complete(null);
				return HttpResponse.BodySubscribers.fromLineSubscriber(new EventLineSubscriber(sink));
			});

			exchange.whenComplete((response, error) -> {
				if (error != null) {
					if (!negotiation.completeExceptionally(error)) {
						sink.tryEmitError(error);
					}
				}
			});

			return Mono.fromFuture(negotiation)
				// 先取消sink再中止请求，中止产生的IOException不会再到达订阅者
				.thenReturn(sink.asFlux().doFinally(signal -> exchange.cancel(true)))
				.doOnError(error -> exchange.cancel(true))
				.doOnCancel(() -> exchange.cancel(true));
		});
	}

	static boolean isEventStream(String contentType) {
		int semicolon = contentType.indexOf(';');
		String mediaType = (semicolon < 0) ? contentType : contentType.substring(0, semicolon);
		return EVENT_STREAM_MEDIA_TYPE.equals(mediaType.trim().toLowerCase(Locale.ROOT));
	}

	/**
	 * 按行解析标准事件流格式并把事件写入sink。
	 */
	private static final class EventLineSubscriber implements Flow.Subscriber<String> {

		private final Sinks.Many<StreamEvent> sink;

		private final StringBuilder data = new StringBuilder();

		private String eventType;

		private String lastEventId;

		EventLineSubscriber(Sinks.Many<StreamEvent> sink) {
			this.sink = sink;
		}

		@Override
		public void onSubscribe(Flow.Subscription subscription) {
			subscription.request(Long.MAX_VALUE);
		}

		@Override
		public void onNext(String line) {
			if (line.isEmpty()) {
				dispatch();
				return;
			}
			if (line.startsWith(":")) {
				return;
			}

			int colon = line.indexOf(':');
			String field = (colon < 0) ? line : line.substring(0, colon);
			String value = (colon < 0) ? "" : line.substring(colon + 1);
			if (value.startsWith(" ")) {
				value = value.substring(1);
			}

			if ("event".equals(field)) {
				this.eventType = value;
			}
			else if ("data".equals(field)) {
				this.data.append(value).append('\n');
			}
			else if ("id".equals(field) && value.indexOf('\0') < 0) {
				this.lastEventId = value;
			}
		}

		private void dispatch() {
			if (this.data.length() == 0) {
				this.eventType = null;
				return;
			}
			this.data.setLength(this.data.length() - 1);
			String type = (this.eventType == null || this.eventType.isEmpty()) ? DEFAULT_EVENT_TYPE : this.eventType;
			this.sink.tryEmitNext(new StreamEvent(type, this.lastEventId, this.data.toString()));
			this.data.setLength(0);
			this.eventType = null;
		}

		@Override
		public void onError(Throwable throwable) {
			this.sink.tryEmitError(throwable);
		}

		@Override
		public void onComplete() {
			logger.debug("Event stream body completed");
			this.sink.tryEmitComplete();
		}

	}

}
