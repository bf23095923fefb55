package com.pricetracker.scraper.infrastructure.marketplace;

import com.pricetracker.common.event.Marketplace;
import com.pricetracker.scraper.domain.extraction.ExtractedListing;
import java.math.BigDecimal;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Component
public class AmazonExtractor extends HtmlListingExtractor {

    private static final Pattern ASIN = Pattern.compile("/dp/([A-Z0-9]{10})");
    private static final Pattern RATING = Pattern.compile("([\\d.]+) out of");
    private static final Pattern REVIEWS = Pattern.compile("([\\d,]+)");

    @Override
    public Marketplace marketplace() {
        return Marketplace.AMAZON;
    }

    @Override
    protected ExtractedListing parse(URI url, Document document) {
        var price = requirePrice(document.selectFirst(
                ".a-price-whole, .a-price.a-text-price.a-size-medium.apexPriceToPay, .a-price-range"));

        var availability = text(document.selectFirst("#availability span"));
        var brand = text(document.selectFirst("a#bylineInfo"));
        var rating = firstGroup(RATING, text(document.selectFirst("span.a-icon-alt")));
        var reviews = firstGroup(REVIEWS, text(document.selectFirst("#acrCustomerReviewText")));
        var image = document.selectFirst("#landingImage, #imgBlkFront");
        var breadcrumbs = document.select("#wayfinding-breadcrumbs_feature_div a.a-link-normal");

        return ExtractedListing.builder()
                .marketplaceId(firstGroup(ASIN, url.getPath()))
                .title(titleOrUnknown(document.selectFirst("#productTitle")))
                .price(price)
                .inStock(availability == null || availability.toLowerCase(Locale.ROOT).contains("in stock"))
                .brand(brand == null ? null : brand.replace("Brand: ", ""))
                .sellerRating(rating == null ? null : new BigDecimal(rating))
                .reviewsCount(reviews == null ? null : Integer.valueOf(reviews.replace(",", "")))
                .imageUrl(image == null ? null : image.attr("src"))
                .category(breadcrumbs.isEmpty() ? null : text(breadcrumbs.last()))
                .build();
    }
}
