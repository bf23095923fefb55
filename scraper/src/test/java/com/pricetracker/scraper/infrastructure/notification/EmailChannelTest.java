package com.pricetracker.scraper.infrastructure.notification;

import com.pricetracker.common.event.AlertKind;
import com.pricetracker.scraper.application.config.ScraperProperties;
import com.pricetracker.scraper.domain.exceptions.ChannelDeliveryException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.IContext;

import static com.pricetracker.scraper.infrastructure.notification.NotificationFixtures.notification;
import static com.pricetracker.scraper.infrastructure.notification.NotificationFixtures.subscriber;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
class EmailChannelTest {

    private static final String LONG_TITLE = "Apple iPhone 13 128GB Unlocked Smartphone with Dual Camera - Midnight";

    @Mock
    JavaMailSender mailSender;

    @Mock
    ITemplateEngine templateEngine;

    EmailChannel channel;

    @BeforeEach
    void setUp() {
        var properties = new ScraperProperties(
                null,
                null,
                null,
                new ScraperProperties.Alerts(
                        new BigDecimal("0.10"), null, Duration.ofSeconds(30),
                        "noreply@pricetracker.com", "https://app.pricetracker.com"),
                null);
        channel = new EmailChannel(mailSender, templateEngine, properties);
    }

    @Test
    void send_rendersKindTemplateAndMailsSubscriber() throws Exception {
        // given
        given(mailSender.createMimeMessage()).willReturn(new MimeMessage((Session) null));
        given(templateEngine.process(eq("alerts/price-drop"), any(IContext.class))).willReturn("<p>drop</p>");

        // when
        channel.send(notification(AlertKind.PRICE_DROP, "Echo Dot"), subscriber());

        // then
        var sent = ArgumentCaptor.forClass(MimeMessage.class);
        then(mailSender).should().send(sent.capture());
        var message = sent.getValue();
        assertThat(message.getSubject()).isEqualTo("💰 15.0% Price Drop: Echo Dot...");
        assertThat(message.getFrom()[0].toString()).isEqualTo("noreply@pricetracker.com");
        assertThat(message.getAllRecipients()[0].toString()).isEqualTo("owner@example.com");

        var context = ArgumentCaptor.forClass(IContext.class);
        then(templateEngine).should().process(eq("alerts/price-drop"), context.capture());
        assertThat(context.getValue().getVariable("unsubscribeUrl"))
                .isEqualTo("https://app.pricetracker.com/unsubscribe/" + subscriber().userId());
        assertThat(context.getValue().getVariable("settingsUrl")).isEqualTo("https://app.pricetracker.com/settings");
    }

    @Test
    void send_transportFailure_raisesChannelDeliveryException() {
        // given
        given(mailSender.createMimeMessage()).willReturn(new MimeMessage((Session) null));
        given(templateEngine.process(eq("alerts/new-low"), any(IContext.class))).willReturn("<p>low</p>");
        willThrow(new MailSendException("connection refused")).given(mailSender).send(any(MimeMessage.class));

        // when / then
        assertThatThrownBy(() -> channel.send(notification(AlertKind.NEW_LOW, "Lamp"), subscriber()))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessageContaining("connection refused")
                .hasCauseInstanceOf(MailSendException.class);
    }

    @Test
    void subject_perKind_truncatesTitle() {
        var truncated = LONG_TITLE.substring(0, 50);

        assertThat(EmailChannel.subject(notification(AlertKind.NEW_LOW, LONG_TITLE)))
                .isEqualTo("🔥 All-Time Low Price: " + truncated + "...");
        assertThat(EmailChannel.subject(notification(AlertKind.BACK_IN_STOCK, LONG_TITLE)))
                .isEqualTo("📦 Back in Stock: " + truncated + "...");
        assertThat(EmailChannel.subject(notification(AlertKind.PRICE_INCREASE, "Lamp")))
                .isEqualTo("Price Alert: Lamp...");
    }

    @Test
    void templateFor_mapsEveryKind() {
        assertThat(EmailChannel.templateFor(AlertKind.PRICE_DROP)).isEqualTo("alerts/price-drop");
        assertThat(EmailChannel.templateFor(AlertKind.PRICE_INCREASE)).isEqualTo("alerts/price-drop");
        assertThat(EmailChannel.templateFor(AlertKind.NEW_LOW)).isEqualTo("alerts/new-low");
        assertThat(EmailChannel.templateFor(AlertKind.BACK_IN_STOCK)).isEqualTo("alerts/back-in-stock");
    }

    @Test
    void isEnabledFor_requiresFlagAndAddress() {
        assertThat(channel.isEnabledFor(subscriber())).isTrue();
        assertThat(channel.isEnabledFor(subscriber().toBuilder().emailEnabled(false).build())).isFalse();
        assertThat(channel.isEnabledFor(subscriber().toBuilder().email(null).build())).isFalse();
    }
}
