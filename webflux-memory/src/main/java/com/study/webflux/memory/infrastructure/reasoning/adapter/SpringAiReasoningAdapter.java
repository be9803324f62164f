package com.study.webflux.memory.infrastructure.reasoning.adapter;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.memory.domain.memory.port.ReasoningPort;
import com.study.webflux.memory.domain.memory.port.ReasoningRequest;
import com.study.webflux.memory.infrastructure.memory.config.MemoryTimeoutConfig;
import com.study.webflux.memory.infrastructure.memory.config.ReasoningConfig;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI ChatModel로 구조화 응답을 요청하는 추론 어댑터입니다.
 *
 * <p>
 * 출력 타입에서 생성한 JSON 스키마를 프롬프트에 덧붙이고, 응답을 같은 타입으로 역직렬화합니다. 역직렬화에 실패하면 대체 값 없이 에러로
 * 종료합니다.
 */
@Slf4j
@Component
public class SpringAiReasoningAdapter implements ReasoningPort {

	private final ChatModel chatModel;
	private final ObjectMapper objectMapper;
	private final ReasoningConfig config;
	private final MemoryTimeoutConfig timeouts;

	public SpringAiReasoningAdapter(ChatModel chatModel,
		ObjectMapper objectMapper,
		ReasoningConfig config,
		MemoryTimeoutConfig timeouts) {
		this.chatModel = chatModel;
		this.objectMapper = objectMapper;
		this.config = config;
		this.timeouts = timeouts;
	}

	@Override
	public <T> Mono<T> complete(ReasoningRequest request, Class<T> outputType) {
		BeanOutputConverter<T> converter = new BeanOutputConverter<>(outputType, objectMapper);
		Prompt prompt = new Prompt(buildMessages(request, converter.getFormat()), buildOptions());

		return Mono.fromCallable(() -> {
			ChatResponse response = chatModel.call(prompt);
			String content = extractContent(response);
			return convert(converter, content, outputType);
		})
			.subscribeOn(Schedulers.boundedElastic())
			.timeout(timeouts.reasoning());
	}

	private List<Message> buildMessages(ReasoningRequest request, String format) {
		List<Message> messages = new ArrayList<>();
		if (!request.systemPrompt().isBlank()) {
			messages.add(new SystemMessage(request.systemPrompt()));
		}
		messages.add(new UserMessage(request.userPrompt() + "\n\n" + format));
		return messages;
	}

	private OpenAiChatOptions buildOptions() {
		return OpenAiChatOptions.builder()
			.model(config.model())
			.temperature(config.temperature())
			.build();
	}

	private String extractContent(ChatResponse response) {
		if (response == null || response.getResult() == null
			|| response.getResult().getOutput() == null) {
			throw new IllegalStateException("Invalid response from LLM");
		}
		String text = response.getResult().getOutput().getText();
		if (text == null || text.isBlank()) {
			throw new IllegalStateException("Empty response from LLM");
		}
		return text;
	}

	private <T> T convert(BeanOutputConverter<T> converter, String content, Class<T> outputType) {
		T result;
		try {
			result = converter.convert(content);
		} catch (RuntimeException e) {
			log.debug("구조화 응답 변환 실패: type={}, content={}", outputType.getSimpleName(), content);
			throw new IllegalStateException(
				"LLM response does not conform to " + outputType.getSimpleName(), e);
		}
		if (result == null) {
			throw new IllegalStateException(
				"LLM response does not conform to " + outputType.getSimpleName());
		}
		return result;
	}
}
