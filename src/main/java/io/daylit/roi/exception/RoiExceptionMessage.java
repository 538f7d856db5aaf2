package io.daylit.roi.exception;

public enum RoiExceptionMessage {
	INVALID_HOURS_PER_FTE(10001),
	INVALID_WORKING_DAYS(10002),
	INPUTS_REQUIRED(10003),
	ASSUMPTIONS_REQUIRED(10004);

	private int code;

	public int getCode() {
		return code;
	}

	private RoiExceptionMessage(int code) {
		this.code = code;
	}
}
