package com.study.webflux.memory.infrastructure.vectordb.adapter;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.memory.infrastructure.memory.config.QdrantConfig;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantCreateCollectionRequest;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantCreateIndexRequest;
import reactor.core.publisher.Mono;

/**
 * Qdrant 컬렉션 존재 여부를 확인하고 필요 시 컬렉션과 페이로드 인덱스를 생성합니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "memory.store.type", havingValue = "qdrant", matchIfMissing = true)
public class QdrantCollectionInitializer implements ApplicationRunner {

	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

	private final QdrantConfig config;
	private final WebClient webClient;

	public QdrantCollectionInitializer(QdrantConfig config, WebClient.Builder webClientBuilder) {
		this.config = config;
		WebClient.Builder builder = webClientBuilder.clone()
			.baseUrl(trimTrailingSlash(config.url()));
		if (StringUtils.hasText(config.apiKey())) {
			builder.defaultHeader("api-key", config.apiKey());
		}
		this.webClient = builder.build();
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!config.autoCreateCollection()) {
			log.info("Qdrant 컬렉션 자동 생성이 비활성화되어 초기화를 건너뜁니다. collection={}",
				config.collectionName());
			return;
		}

		if (collectionExists(config.collectionName())) {
			log.info("Qdrant 컬렉션이 이미 존재합니다. collection={}", config.collectionName());
			return;
		}

		createCollection(config.collectionName(), config.vectorDimension());
		createPayloadIndex(QdrantPayloadMapper.USER_ID, "keyword");
		createPayloadIndex(QdrantPayloadMapper.CREATED_AT, "integer");
	}

	private boolean collectionExists(String collectionName) {
		return webClient.get()
			.uri("/collections/{collectionName}", collectionName)
			.exchangeToMono(response -> {
				HttpStatusCode status = response.statusCode();
				if (status.is2xxSuccessful()) {
					return Mono.just(true);
				}
				if (status.value() == 404) {
					return Mono.just(false);
				}
				return response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.error(new IllegalStateException(
						"Qdrant 컬렉션 조회 실패 status=" + status.value() + " body=" + body)));
			})
			.blockOptional(REQUEST_TIMEOUT)
			.orElse(false);
	}

	private void createCollection(String collectionName, int vectorDimension) {
		QdrantCreateCollectionRequest request = new QdrantCreateCollectionRequest(
			new QdrantCreateCollectionRequest.VectorParams(vectorDimension, "Cosine"));

		webClient.put()
			.uri("/collections/{collectionName}", collectionName)
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(request)
			.exchangeToMono(response -> {
				HttpStatusCode status = response.statusCode();
				if (status.is2xxSuccessful() || status.value() == 409) {
					return Mono.empty();
				}
				return response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.error(new IllegalStateException(
						"Qdrant 컬렉션 생성 실패 status=" + status.value() + " body=" + body)));
			})
			.block(REQUEST_TIMEOUT);

		log.info("Qdrant 컬렉션을 준비했습니다. collection={}, vectorDimension={}",
			collectionName,
			vectorDimension);
	}

	/**
	 * 인덱스는 필터 성능용이므로 생성 실패 시 경고만 남기고 기동을 계속합니다.
	 */
	private void createPayloadIndex(String fieldName, String fieldSchema) {
		try {
			webClient.put()
				.uri("/collections/{collectionName}/index?wait=true", config.collectionName())
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(new QdrantCreateIndexRequest(fieldName, fieldSchema))
				.retrieve()
				.toBodilessEntity()
				.block(REQUEST_TIMEOUT);
			log.info("Qdrant 페이로드 인덱스를 생성했습니다. field={}, schema={}", fieldName, fieldSchema);
		} catch (RuntimeException e) {
			log.warn("Qdrant 페이로드 인덱스 생성 실패: field={}, error={}", fieldName, e.getMessage());
		}
	}

	private String trimTrailingSlash(String url) {
		if (!StringUtils.hasText(url)) {
			return "";
		}
		if (url.endsWith("/")) {
			return url.substring(0, url.length() - 1);
		}
		return url;
	}
}
