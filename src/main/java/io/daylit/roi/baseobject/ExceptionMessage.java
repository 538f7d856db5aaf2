package io.daylit.roi.baseobject;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExceptionMessage implements Serializable {

	private static final long serialVersionUID = 1L;

	private Integer messageID;

	private String errorMessage;

	private String friendlyMessage;

	private String messageType;
}
