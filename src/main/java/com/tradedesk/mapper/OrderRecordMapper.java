package com.tradedesk.mapper;

import com.tradedesk.api.dto.response.AccountValueRecord;
import com.tradedesk.api.dto.response.AuditEntryRecord;
import com.tradedesk.api.dto.response.FillRecord;
import com.tradedesk.api.dto.response.OrderRecord;
import com.tradedesk.api.dto.response.PositionRecord;
import com.tradedesk.domain.enums.OptionRight;
import com.tradedesk.domain.model.AccountValue;
import com.tradedesk.domain.model.AuditEntry;
import com.tradedesk.domain.model.Instrument;
import com.tradedesk.domain.model.OptionInstrument;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.OrderFill;
import com.tradedesk.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from ledger domain models to the API record DTOs.
 *
 * <p>Order's instrument is flattened: symbol and asset class come from the Order's own
 * derived getters, the option fields from the named helpers below (null for stocks).
 */
@Mapper(componentModel = "spring")
public interface OrderRecordMapper {

    @Mapping(target = "expiry", source = "instrument", qualifiedByName = "optionExpiry")
    @Mapping(target = "strike", source = "instrument", qualifiedByName = "optionStrike")
    @Mapping(target = "right", source = "instrument", qualifiedByName = "optionRight")
    OrderRecord toRecord(Order order);

    List<OrderRecord> toOrderRecords(List<Order> orders);

    FillRecord toRecord(OrderFill fill);

    List<FillRecord> toFillRecords(List<OrderFill> fills);

    PositionRecord toRecord(Position position);

    List<PositionRecord> toPositionRecords(List<Position> positions);

    AccountValueRecord toRecord(AccountValue accountValue);

    List<AccountValueRecord> toAccountValueRecords(List<AccountValue> accountValues);

    AuditEntryRecord toRecord(AuditEntry entry);

    List<AuditEntryRecord> toAuditEntryRecords(List<AuditEntry> entries);

    @Named("optionExpiry")
    default String optionExpiry(Instrument instrument) {
        return instrument instanceof OptionInstrument option ? option.expiry() : null;
    }

    @Named("optionStrike")
    default BigDecimal optionStrike(Instrument instrument) {
        return instrument instanceof OptionInstrument option ? option.strike() : null;
    }

    @Named("optionRight")
    default OptionRight optionRight(Instrument instrument) {
        return instrument instanceof OptionInstrument option ? option.right() : null;
    }
}
