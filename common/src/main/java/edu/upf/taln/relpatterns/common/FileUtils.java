package edu.upf.taln.relpatterns.common;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.LineIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * Iterates lazily over the lines of a stream, so that input can be processed as it arrives.
	 * The caller is responsible for closing the iterator.
	 */
	public static LineIterator iterateLines(InputStream input, Charset encoding)
	{
		return IOUtils.lineIterator(input, encoding);
	}

	public static LineIterator iterateLines(Path file, Charset encoding) throws IOException
	{
		log.info("Reading patterns from " + file);
		return IOUtils.lineIterator(Files.newInputStream(file), encoding);
	}
}
