package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;

public interface OrganizerAllowlistPort {

    boolean isAllowed(Address organizer);

    void setAllowed(Address organizer, boolean allowed);
}
