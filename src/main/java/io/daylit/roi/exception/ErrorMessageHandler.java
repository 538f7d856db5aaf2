package io.daylit.roi.exception;

import java.util.Locale;

import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

import io.daylit.roi.baseobject.ExceptionMessage;
import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class ErrorMessageHandler {

	private final MessageSource messageSource;

	public ExceptionMessage createExceptionMessage(NotValidException exception) {
		return createExceptionMessage(exception.getCode(), ExceptionType.VALIDATION, exception.getArgs());
	}

	public ExceptionMessage createExceptionMessage(RoiExceptionMessage message, ExceptionType errorType,
		Object... args) {
		return ExceptionMessage.builder()
			.messageID(message.getCode())
			.errorMessage(message.name())
			.friendlyMessage(getFriendlyMessage(message.name(), args))
			.messageType(errorType.getType())
			.build();
	}

	private String getFriendlyMessage(String errorMessage, Object[] args) {
		return messageSource.getMessage(errorMessage, args, errorMessage, getLocale());
	}

	private Locale getLocale() {
		return LocaleContextHolder.getLocale();
	}
}
