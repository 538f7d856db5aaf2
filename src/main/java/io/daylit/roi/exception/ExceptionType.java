package io.daylit.roi.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExceptionType {

	VALIDATION("validation");

	private final String type;
}
