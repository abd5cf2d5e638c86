package com.itsm.watchtower.audit;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.SequenceInputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Reads the request body up front so that it can be audited and still be read by the handler.
 * <p>
 * At most {@code maxBodyBytes} are kept. When the body is longer, nothing is captured and the handler reads the
 * bytes already consumed followed by the remainder of the original stream.
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

    private final byte[] prefix;
    private final boolean complete;

    public CachedBodyHttpServletRequest(HttpServletRequest request, int maxBodyBytes) throws IOException {
        super(request);
        int readLimit = maxBodyBytes == Integer.MAX_VALUE ? maxBodyBytes : maxBodyBytes + 1;
        this.prefix = request.getInputStream().readNBytes(readLimit);
        this.complete = prefix.length <= maxBodyBytes;
    }

    /**
     * @return the whole body, or {@code null} when it was larger than the capture limit
     */
    public byte[] getBody() {
        return complete ? prefix : null;
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (complete) {
            return new ReplayingInputStream(new ByteArrayInputStream(prefix));
        }
        return new ReplayingInputStream(new SequenceInputStream(new ByteArrayInputStream(prefix), super.getInputStream()));
    }

    @Override
    public BufferedReader getReader() throws IOException {
        String encoding = getCharacterEncoding();
        Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
        return new BufferedReader(new InputStreamReader(getInputStream(), charset));
    }

    @Override
    public int getContentLength() {
        return complete ? prefix.length : super.getContentLength();
    }

    @Override
    public long getContentLengthLong() {
        return complete ? prefix.length : super.getContentLengthLong();
    }

    private static class ReplayingInputStream extends ServletInputStream {
        private final InputStream inputStream;
        private boolean finished;

        ReplayingInputStream(InputStream inputStream) {
            this.inputStream = inputStream;
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            throw new UnsupportedOperationException("Non blocking reads are not supported on a cached body");
        }

        @Override
        public int read() throws IOException {
            int read = inputStream.read();
            finished = read == -1;
            return read;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int read = inputStream.read(b, off, len);
            finished = read == -1;
            return read;
        }
    }
}
