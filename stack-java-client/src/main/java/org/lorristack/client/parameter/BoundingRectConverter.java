package org.lorristack.client.parameter;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import org.lorristack.alignment.stack.BoundingRect;

/**
 * Converts "x,y,w,h" command line values to rectangles.
 */
public class BoundingRectConverter
        implements IStringConverter<BoundingRect> {

    @Override
    public BoundingRect convert(final String value)
            throws ParameterException {
        try {
            return BoundingRect.parse(value);
        } catch (final IllegalArgumentException e) {
            throw new ParameterException(e.getMessage(), e);
        }
    }
}
