package com.pricetracker.scraper.infrastructure.marketplace;

import com.pricetracker.common.event.Marketplace;
import com.pricetracker.scraper.domain.extraction.ExtractedListing;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Component
public class EbayExtractor extends HtmlListingExtractor {

    private static final Pattern ITEM_ID = Pattern.compile("/itm/(\\d+)");
    private static final Pattern FEEDBACK_PERCENT = Pattern.compile("([\\d.]+)%");
    private static final Pattern AMOUNT = Pattern.compile("([\\d.]+)");
    private static final BigDecimal PERCENT_PER_STAR = BigDecimal.valueOf(20);

    @Override
    public Marketplace marketplace() {
        return Marketplace.EBAY;
    }

    @Override
    protected ExtractedListing parse(URI url, Document document) {
        var price = requirePrice(document.selectFirst(".x-price-primary span.ux-textspans"));

        var feedback = firstGroup(FEEDBACK_PERCENT, text(document.selectFirst(".si-inner .perCnt")));
        var quantity = text(document.selectFirst("#qtySubTxt"));

        return ExtractedListing.builder()
                .marketplaceId(firstGroup(ITEM_ID, url.getPath()))
                .title(titleOrUnknown(document.selectFirst("h1.it-ttl, h1.x-item-title__mainTitle")))
                .price(price)
                .inStock(quantity == null || !quantity.toLowerCase(Locale.ROOT).contains("out of stock"))
                .sellerName(text(document.selectFirst(".si-inner .mbg-nw")))
                .sellerRating(feedback == null
                        ? null
                        : new BigDecimal(feedback).divide(PERCENT_PER_STAR, 2, RoundingMode.HALF_UP))
                .shippingCost(shippingCost(text(document.selectFirst(".vi-acc-del-range b"))))
                .build();
    }

    private static BigDecimal shippingCost(String shipping) {
        if (shipping == null || shipping.toLowerCase(Locale.ROOT).contains("free")) {
            return BigDecimal.ZERO;
        }
        var amount = firstGroup(AMOUNT, shipping);
        return amount == null ? BigDecimal.ZERO : new BigDecimal(amount);
    }
}
