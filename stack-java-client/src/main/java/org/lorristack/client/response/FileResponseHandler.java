package org.lorristack.client.response;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.ResponseHandler;

/**
 * Writes response content stream to a file.
 */
public class FileResponseHandler
        extends BaseResponseHandler
        implements ResponseHandler<File> {

    private final File file;

    /**
     * @param  requestContext  context (e.g. "GET http://pluto.jhuapl.edu") for use in error messages.
     * @param  file            file to which response should be written.
     */
    public FileResponseHandler(final String requestContext,
                               final File file) {
        super(requestContext);
        this.file = file;
    }

    @Override
    public File handleResponse(final HttpResponse response)
            throws IOException {

        final HttpEntity entity = getValidatedResponseEntity(response, OK);
        if (entity == null) {
            throw new ClientProtocolException("empty response returned for " + getRequestContext());
        }

        try (final InputStream in = entity.getContent();
             final OutputStream out = new FileOutputStream(file)) {
            IOUtils.copyLarge(in, out);
        }

        return file;
    }
}
