package org.lorristack.client.response;

import java.io.IOException;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.ResponseHandler;

/**
 * Returns the response content (e.g. an archive listing page) as text.
 */
public class TextResponseHandler
        extends BaseResponseHandler
        implements ResponseHandler<String> {

    /**
     * @param  requestContext  context (e.g. "GET http://pluto.jhuapl.edu") for use in error messages.
     */
    public TextResponseHandler(final String requestContext) {
        super(requestContext);
    }

    @Override
    public String handleResponse(final HttpResponse response)
            throws IOException {
        final HttpEntity entity = getValidatedResponseEntity(response, OK);
        return getResponseBodyText(entity);
    }
}
