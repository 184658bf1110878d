/*
* Copyright 2024 - 2024 the original author or authors.
*/
package io.ssemcp.client.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

import io.ssemcp.spec.StreamEvent;
import io.ssemcp.util.Assert;
import org.reactivestreams.FlowAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 逐块读取HTTP响应体并用{@link SseStreamDecoder}重组事件的回退读取器。
 *
 * <p>
 * 不检查响应的{@code Content-Type}，任何低于400的状态码都被接受。
 */
public class HttpStreamingSseReader {

	private static final Logger logger = LoggerFactory.getLogger(HttpStreamingSseReader.class);

	private final HttpClient httpClient;

	public HttpStreamingSseReader(HttpClient httpClient) {
		Assert.notNull(httpClient, "httpClient must not be null");
		this.httpClient = httpClient;
	}

	/**
	 * 打开事件流。
	 * @param uri 事件流地址
	 * @param headers 附加的请求头，与默认的{@code Accept}同名时覆盖它
	 * @return 收到响应头后发出事件序列的Mono；状态码不低于400时以{@link SseConnectionException}失败
	 */
	public Mono<Flux<StreamEvent>> open(URI uri, Map<String, String> headers) {
		return Mono.defer(() -> {
			HttpRequest.Builder builder = HttpRequest.newBuilder(uri).header("Accept", "text/event-stream").GET();
			headers.forEach(builder::setHeader);

			return Mono
				.fromFuture(() -> this.httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofPublisher()))
				.map(response -> {
					if (response.statusCode() >= 400) {
						discardBody(response.body());
						throw new SseConnectionException("Failed to open event stream", response.statusCode());
					}
					return decode(response.body());
				});
		});
	}

	private static Flux<StreamEvent> decode(Flow.Publisher<List<ByteBuffer>> body) {
		return Flux.defer(() -> {
			SseStreamDecoder decoder = new SseStreamDecoder();
			return Flux.from(FlowAdapters.toPublisher(body))
				.concatMapIterable((List<ByteBuffer> buffers) -> decoder.decode(buffers))
				.doOnComplete(decoder::finish);
		});
	}

	private static void discardBody(Flow.Publisher<List<ByteBuffer>> body) {
		body.subscribe(new Flow.Subscriber<>() {
			@Override
			public void onSubscribe(Flow.Subscription subscription) {
				subscription.cancel();
			}

			@Override
			public void onNext(List<ByteBuffer> item) {
			}

			@Override
			public void onError(Throwable throwable) {
				logger.debug("Discarded response body failed", throwable);
			}

			@Override
			public void onComplete() {
			}
		});
	}

}
