package axios.mail.sync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

/**
 * Connection settings of an IMAP account. The password is read from
 * {@code passwordFile} at connect time and never stored in the database.
 */
@Embeddable
@Data
public class ImapSettings {
    @Column(name = "imap_host")
    private String host;

    @Column(name = "imap_port")
    private Integer port = 993;

    @Column(name = "imap_ssl")
    private Boolean ssl = true;

    @Column(name = "imap_username")
    private String username;

    @Column(name = "imap_password_file")
    private String passwordFile;

    @Column(name = "imap_inbox_folder")
    private String inboxFolder = "INBOX";

    @Column(name = "imap_trash_folder")
    private String trashFolder = "Trash";
}
