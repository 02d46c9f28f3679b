package com.pointbreak.award.session;

import com.pointbreak.award.interfaces.BrowserSession;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.SessionCookie;

import java.util.List;

/**
 * Output of one successful warm-up: the live page, the identity it used and the cookies it earned.
 */
public record HydratedSession(BrowserSession browserSession, Fingerprint fingerprint, List<SessionCookie> cookies) {
}
