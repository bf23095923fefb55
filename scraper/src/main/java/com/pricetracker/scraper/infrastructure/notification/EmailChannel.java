package com.pricetracker.scraper.infrastructure.notification;

import com.pricetracker.common.event.AlertKind;
import com.pricetracker.scraper.application.config.ScraperProperties;
import com.pricetracker.scraper.domain.alert.AlertNotification;
import com.pricetracker.scraper.domain.alert.NotificationChannel;
import com.pricetracker.scraper.domain.alert.SubscriberSettings;
import com.pricetracker.scraper.domain.exceptions.ChannelDeliveryException;
import jakarta.mail.MessagingException;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;

/**
 * HTML email rendered from {@code templates/alerts/<kind>.html}. Kinds without their own
 * template use the price-drop layout.
 */
@Slf4j
@Component
public class EmailChannel implements NotificationChannel {

    public static final String TYPE = "email";

    static final int SUBJECT_TITLE_LENGTH = 50;

    private final JavaMailSender mailSender;
    private final ITemplateEngine templateEngine;
    private final String mailFrom;
    private final String frontendUrl;

    public EmailChannel(JavaMailSender mailSender, ITemplateEngine templateEngine, ScraperProperties properties) {
        this.mailSender = mailSender;
        this.templateEngine = templateEngine;
        this.mailFrom = properties.alerts().mailFrom();
        this.frontendUrl = properties.alerts().frontendUrl();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean isEnabledFor(SubscriberSettings subscriber) {
        return subscriber.emailEnabled() && subscriber.email() != null && !subscriber.email().isBlank();
    }

    @Override
    public void send(AlertNotification notification, SubscriberSettings subscriber) {
        var html = templateEngine.process(templateFor(notification.event().kind()), context(notification, subscriber));
        try {
            var message = mailSender.createMimeMessage();
            var helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(mailFrom);
            helper.setTo(subscriber.email());
            helper.setSubject(subject(notification));
            helper.setText(html, true);
            mailSender.send(message);
            log.info("Email sent for alert {} to {}", notification.event().id(), subscriber.email());
        } catch (MessagingException | MailException e) {
            throw ChannelDeliveryException.of(TYPE, e);
        }
    }

    static String templateFor(AlertKind kind) {
        return switch (kind) {
            case NEW_LOW -> "alerts/new-low";
            case BACK_IN_STOCK -> "alerts/back-in-stock";
            case PRICE_DROP, PRICE_INCREASE -> "alerts/price-drop";
        };
    }

    static String subject(AlertNotification notification) {
        var title = shortTitle(notification.item().title());
        var event = notification.event();
        return switch (event.kind()) {
            case PRICE_DROP -> String.format(
                    Locale.ROOT,
                    "💰 %s%% Price Drop: %s...",
                    event.percentChange().abs().setScale(1, RoundingMode.HALF_UP).toPlainString(),
                    title);
            case NEW_LOW -> "🔥 All-Time Low Price: " + title + "...";
            case BACK_IN_STOCK -> "📦 Back in Stock: " + title + "...";
            case PRICE_INCREASE -> "Price Alert: " + title + "...";
        };
    }

    private static String shortTitle(String title) {
        if (title == null) {
            return "";
        }
        return title.length() <= SUBJECT_TITLE_LENGTH ? title : title.substring(0, SUBJECT_TITLE_LENGTH);
    }

    private Context context(AlertNotification notification, SubscriberSettings subscriber) {
        var context = new Context(Locale.ROOT);
        context.setVariable("alert", notification.event());
        context.setVariable("item", notification.item());
        var statistics = notification.item().statistics();
        context.setVariable("previousLow", statistics == null ? null : statistics.minPrice());
        context.setVariable("unsubscribeUrl", frontendUrl + "/unsubscribe/" + subscriber.userId());
        context.setVariable("settingsUrl", frontendUrl + "/settings");
        return context;
    }
}
