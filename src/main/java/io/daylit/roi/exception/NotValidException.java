package io.daylit.roi.exception;

import java.util.Arrays;

import lombok.Getter;

/**
 * Raised when calculation inputs or assumptions cannot produce a well-defined result.
 */
@Getter
public class NotValidException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final RoiExceptionMessage code;

	private final transient Object[] args;

	public NotValidException(RoiExceptionMessage code, Object... args) {
		super(String.format("%s(%d) args=%s", code.name(), code.getCode(), Arrays.toString(args)));
		this.code = code;
		this.args = args;
	}
}
