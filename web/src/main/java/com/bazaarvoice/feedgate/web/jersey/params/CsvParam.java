package com.bazaarvoice.feedgate.web.jersey.params;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.dropwizard.jersey.params.AbstractParam;

import java.util.List;

/**
 * A comma-separated list such as {@code skipColumns=payload,output}.  Blank entries are dropped.
 */
public class CsvParam extends AbstractParam<List<String>> {

    private static final Splitter SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public CsvParam(String input) {
        super(input);
    }

    @Override
    protected List<String> parse(String input) {
        return ImmutableList.copyOf(SPLITTER.split(input));
    }
}
