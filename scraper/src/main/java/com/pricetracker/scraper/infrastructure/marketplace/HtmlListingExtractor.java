package com.pricetracker.scraper.infrastructure.marketplace;

import com.pricetracker.scraper.domain.exceptions.PageParseException;
import com.pricetracker.scraper.domain.extraction.ExtractedListing;
import com.pricetracker.scraper.domain.extraction.MarketplaceExtractor;
import com.pricetracker.scraper.domain.extraction.PageTransport;
import java.math.BigDecimal;
import java.net.URI;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Fetches a listing page and hands the parsed jsoup document to the marketplace-specific
 * field rules.
 */
abstract class HtmlListingExtractor implements MarketplaceExtractor {

    static final String UNKNOWN_TITLE = "Unknown Product";

    private static final Pattern PRICE = Pattern.compile("(-)?\\s*(\\d[\\d,]*(?:\\.\\d+)?)");

    @Override
    public ExtractedListing extract(URI url, PageTransport transport) {
        var page = transport.fetch(url);
        var document = Jsoup.parse(page.body(), url.toString());
        return parse(url, document);
    }

    protected abstract ExtractedListing parse(URI url, Document document);

    /**
     * Reads the first number of {@code element}, ignoring currency symbols and thousands separators.
     */
    protected BigDecimal requirePrice(Element element) {
        if (element == null) {
            throw PageParseException.missingPrice(marketplace());
        }
        var text = element.text();
        var matcher = PRICE.matcher(text);
        if (!matcher.find()) {
            throw PageParseException.missingPrice(marketplace());
        }
        if (matcher.group(1) != null) {
            throw PageParseException.negativePrice(marketplace(), text.trim());
        }
        return new BigDecimal(matcher.group(2).replace(",", ""));
    }

    protected static String text(Element element) {
        if (element == null) {
            return null;
        }
        var text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    protected static String titleOrUnknown(Element element) {
        var title = text(element);
        return title != null ? title : UNKNOWN_TITLE;
    }

    protected static String firstGroup(Pattern pattern, String input) {
        if (input == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(input);
        return matcher.find() ? matcher.group(1) : null;
    }
}
