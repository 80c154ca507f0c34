package cz.vut.fit.domaincheck.models.requests;

import cz.vut.fit.domaincheck.Common;
import org.jetbrains.annotations.Nullable;

/**
 * The WhoisXML API account credentials.
 *
 * @param user     The account user name.
 * @param password The account password.
 */
public record RegistrationCredential(@Nullable String user, @Nullable String password) {
    /**
     * @return True if both the user name and the password are set.
     */
    public boolean isComplete() {
        return !Common.isNullOrBlank(user) && !Common.isNullOrBlank(password);
    }

    @Override
    public String toString() {
        return "RegistrationCredential[user=" + user + ", password=***]";
    }
}
