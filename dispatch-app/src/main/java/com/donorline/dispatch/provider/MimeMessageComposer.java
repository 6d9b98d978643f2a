package com.donorline.dispatch.provider;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Properties;

/**
 * Builds a multipart message with text and HTML alternatives and encodes it as
 * base64url for APIs that take the raw message.
 */
public class MimeMessageComposer {

    private final Session session = Session.getInstance(new Properties());

    public MimeMessage compose(OutboundEmail email, String fromName, String fromAddress) {
        try {
            MimeMessage message = new MimeMessage(session);
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(fromAddress, fromName);
            helper.setTo(new InternetAddress(email.toAddress(), email.toName(), StandardCharsets.UTF_8.name()));
            helper.setSubject(email.subject());
            helper.setText(email.textBody() != null ? email.textBody() : "", email.htmlBody());
            message.saveChanges();
            return message;
        } catch (MessagingException | IOException e) {
            throw new EmailProviderException("Could not build message to " + email.toAddress(), false, e);
        }
    }

    public String composeBase64Url(OutboundEmail email, String fromName, String fromAddress) {
        MimeMessage message = compose(email, fromName, fromAddress);
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        try {
            message.writeTo(raw);
        } catch (MessagingException | IOException e) {
            throw new EmailProviderException("Could not encode message to " + email.toAddress(), false, e);
        }
        return Base64.getUrlEncoder().encodeToString(raw.toByteArray());
    }
}
