package me.golemcore.report.adapter.outbound.notify.mail;

import jakarta.mail.Session;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MailSessionFactoryTest {

    @Test
    void shouldUseSmtpsForSsl() {
        Properties props = MailSessionFactory.createSmtpSession(mail("ssl")).getProperties();

        assertEquals("smtps", props.getProperty("mail.transport.protocol"));
        assertEquals("smtp.acme.io", props.getProperty("mail.smtps.host"));
        assertEquals("465", props.getProperty("mail.smtps.port"));
        assertEquals("true", props.getProperty("mail.smtps.ssl.enable"));
        assertEquals("10000", props.getProperty("mail.smtps.connectiontimeout"));
    }

    @Test
    void shouldRequireStartTlsUpgrade() {
        Properties props = MailSessionFactory.createSmtpSession(mail("STARTTLS")).getProperties();

        assertEquals("smtp", props.getProperty("mail.transport.protocol"));
        assertEquals("587", props.getProperty("mail.smtp.port"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.required"));
        assertNull(props.getProperty("mail.smtp.ssl.enable"));
    }

    @Test
    void shouldUsePlainSmtpWithoutTls() {
        Session session = MailSessionFactory.createSmtpSession(mail("none"));

        assertNull(session.getProperties().getProperty("mail.smtp.starttls.enable"));
        assertEquals("true", session.getProperties().getProperty("mail.smtp.auth"));
    }

    @Test
    void shouldPreferConfiguredPort() {
        ReportProperties.MailProperties mail = mail("ssl");
        mail.setPort(2465);

        assertEquals("2465", MailSessionFactory.createSmtpSession(mail).getProperties().getProperty("mail.smtps.port"));
        assertEquals(25, MailSecurity.NONE.resolvePort(0));
    }

    @Test
    void shouldRejectUnknownSecurityMode() {
        ReportProperties.MailProperties mail = mail("tls13");

        assertThrows(IllegalArgumentException.class, () -> MailSessionFactory.createSmtpSession(mail));
    }

    private static ReportProperties.MailProperties mail(String security) {
        ReportProperties.MailProperties mail = new ReportProperties.MailProperties();
        mail.setHost("smtp.acme.io");
        mail.setUsername("bot@acme.io");
        mail.setPassword("secret");
        mail.setSecurity(security);
        return mail;
    }
}
