package com.pricetracker.scraper.infrastructure.marketplace;

import com.pricetracker.common.event.Marketplace;
import com.pricetracker.scraper.domain.extraction.ExtractedListing;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Reads the server-rendered AliExpress listing. Pages that only render prices client-side
 * fail with a missing-price parse error.
 */
@Component
public class AliExpressExtractor extends HtmlListingExtractor {

    private static final Pattern PRODUCT_ID = Pattern.compile("/item/(\\d+)\\.html");

    @Override
    public Marketplace marketplace() {
        return Marketplace.ALIEXPRESS;
    }

    @Override
    protected ExtractedListing parse(URI url, Document document) {
        var price = requirePrice(document.selectFirst(".product-price-value"));
        var stock = text(document.selectFirst(".product-quantity-tip"));

        return ExtractedListing.builder()
                .marketplaceId(firstGroup(PRODUCT_ID, url.getPath()))
                .title(titleOrUnknown(document.selectFirst(".product-title-text")))
                .price(price)
                .inStock(stock == null || !stock.toLowerCase(Locale.ROOT).contains("out of stock"))
                .build();
    }
}
