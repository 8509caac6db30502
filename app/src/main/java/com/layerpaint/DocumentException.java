package com.layerpaint;

import java.io.IOException;

/**
 * Failure to open or save a document. The live document is never modified when one is thrown.
 */
public class DocumentException extends IOException
{
	public enum Reason
	{
		/** Content is not a document in any known schema version. */
		DECODE,
		/** The file could not be created, written or read. */
		IO,
		/** The file extension maps to no known format. */
		UNSUPPORTED_FORMAT,
		/** Quick save was requested before the document was ever saved. */
		NO_SAVE_PATH
	}

	private final Reason reason;

	public DocumentException(Reason reason, String message)
	{
		super(message);
		this.reason = reason;
	}

	public DocumentException(Reason reason, String message, Throwable cause)
	{
		super(message, cause);
		this.reason = reason;
	}

	public Reason reason()
	{
		return reason;
	}
}
